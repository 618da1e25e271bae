package com.lendingpool.service;

import com.lendingpool.config.LendingProperties;
import com.lendingpool.exception.LendingError;
import com.lendingpool.exception.LendingException;
import com.lendingpool.model.ProtocolState;
import com.lendingpool.repository.ProtocolStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Protocol-wide pause switch and fee recipient.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProtocolStateService {

    private final ProtocolStateRepository repository;
    private final LendingProperties props;

    public ProtocolState current() {
        return repository.findById(ProtocolState.SINGLETON_ID)
                .orElseGet(() -> new ProtocolState(props.getFeeRecipient()));
    }

    public void requireNotPaused() {
        if (current().isPaused()) {
            throw new LendingException(LendingError.PROTOCOL_PAUSED, "Protocol is paused");
        }
    }

    public ProtocolState setPaused(boolean paused) {
        ProtocolState state = current();
        state.setPaused(paused);
        log.warn("Protocol {}", paused ? "PAUSED" : "unpaused");
        return repository.save(state);
    }

    public ProtocolState setFeeRecipient(String feeRecipient) {
        ProtocolState state = current();
        String previous = state.getFeeRecipient();
        state.setFeeRecipient(feeRecipient);
        log.info("Fee recipient changed from {} to {}", previous, feeRecipient);
        return repository.save(state);
    }
}
