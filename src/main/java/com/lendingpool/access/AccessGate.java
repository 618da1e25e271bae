package com.lendingpool.access;

/**
 * Authorization capability injected into the admin surface.
 *
 * The engine never stores roles itself; it asks the gate once per privileged call.
 */
public interface AccessGate {

    boolean authorize(String caller, AdminAction action);
}
