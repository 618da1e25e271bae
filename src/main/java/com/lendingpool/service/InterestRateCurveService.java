package com.lendingpool.service;

import com.lendingpool.config.LendingProperties;
import com.lendingpool.model.InterestRateCurve;
import com.lendingpool.repository.InterestRateCurveRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves which curve applies to a pool: the asset override if one exists, else the
 * protocol default row, else the configured defaults.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InterestRateCurveService {

    private final InterestRateCurveRepository curveRepository;
    private final LendingProperties props;

    public InterestRateCurve curveFor(String asset) {
        return curveRepository.findById(asset)
                .orElseGet(this::defaultCurve);
    }

    public InterestRateCurve defaultCurve() {
        return curveRepository.findById(InterestRateCurve.DEFAULT_SCOPE)
                .orElseGet(this::configuredDefault);
    }

    public InterestRateCurve save(InterestRateCurve curve) {
        InterestRateCurve saved = curveRepository.save(curve);
        log.info("Interest curve for scope {} set to base={} slope1={} slope2={} optimal={} reserveFactor={}",
                saved.getScope(), saved.getBaseRateBps(), saved.getSlope1Bps(), saved.getSlope2Bps(),
                saved.getOptimalUtilizationBps(), saved.getReserveFactorBps());
        return saved;
    }

    public boolean removeOverride(String asset) {
        if (!curveRepository.existsById(asset)) {
            return false;
        }
        curveRepository.deleteById(asset);
        log.info("Removed interest curve override for {}", asset);
        return true;
    }

    private InterestRateCurve configuredDefault() {
        LendingProperties.Interest i = props.getInterest();
        return new InterestRateCurve(InterestRateCurve.DEFAULT_SCOPE,
                i.getBaseRateBps(), i.getSlope1Bps(), i.getSlope2Bps(),
                i.getOptimalUtilizationBps(), i.getReserveFactorBps());
    }
}
