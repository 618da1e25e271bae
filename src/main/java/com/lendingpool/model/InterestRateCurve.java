package com.lendingpool.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Kinked rate curve parameters, all in basis points.
 *
 * The row with scope {@link #DEFAULT_SCOPE} applies to every pool; a row whose scope
 * is an asset id overrides it for that pool only.
 */
@Entity
@Table(name = "interest_rate_curves")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InterestRateCurve {

    public static final String DEFAULT_SCOPE = "*";

    @Id
    private String scope;

    private int baseRateBps;

    private int slope1Bps;

    private int slope2Bps;

    private int optimalUtilizationBps;

    private int reserveFactorBps;
}
