package com.kotsin.enrichment.orchestrator;

import com.kotsin.enrichment.model.Direction;
import com.kotsin.enrichment.model.EnrichmentContext;
import com.kotsin.enrichment.model.MarketSnapshot;
import com.kotsin.enrichment.model.QualityTier;
import com.kotsin.enrichment.model.SanitizedSignal;
import com.kotsin.enrichment.model.Signal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;

/**
 * SignalValidator - Validates and sanitises incoming signals
 *
 * Validation never rejects. Missing fields get defaults, unknown enum values
 * are coerced to neutral ones, out-of-range numbers are clamped or dropped,
 * and every correction is reported as a warning.
 *
 * Checks:
 * 1. Asset and direction present and recognised
 * 2. Quality tier recognised
 * 3. Confidence within [0, 1]
 * 4. Price within (0, 1e6]
 * 5. Market data sane (price, volume, 24h change, volatility)
 */
@Slf4j
@Component
public class SignalValidator {

    static final String UNKNOWN_ASSET = "UNKNOWN";
    static final double DEFAULT_CONFIDENCE = 0.5;
    static final double MAX_PRICE = 1_000_000.0;
    static final double MAX_CHANGE_24H_PCT = 100.0;

    private static final double CRITICAL_FIELD_PENALTY = 0.1;
    private static final double IMPORTANT_FIELD_PENALTY = 0.05;
    private static final double MARKET_FIELD_PENALTY = 0.1;

    private final Clock clock;

    public SignalValidator(Clock clock) {
        this.clock = clock;
    }

    // ======================== MAIN VALIDATION ========================

    public ValidationResult validate(Signal signal, EnrichmentContext context) {
        List<String> warnings = new ArrayList<>();
        Signal input = signal != null ? signal : new Signal();
        if (signal == null) {
            warnings.add("signal missing, using empty signal");
        }

        SanitizedSignal sanitized = SanitizedSignal.builder()
                .signalId(input.getSignalId())
                .asset(sanitizeAsset(input.getAsset(), warnings))
                .direction(sanitizeDirection(input.getDirection(), warnings))
                .qualityTier(sanitizeQualityTier(input.getQualityTier(), warnings))
                .confidence(sanitizeConfidence(input.getConfidence(), warnings))
                .price(sanitizePrice(input.getPrice(), warnings))
                .createdAt(input.getCreatedAt() != null ? input.getCreatedAt() : now(warnings))
                .attributes(input.getAttributes() != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(input.getAttributes()))
                        : Collections.emptyMap())
                .build();

        MarketSnapshot market = context != null ? context.getMarket() : null;
        validateMarket(market, warnings);

        if (!warnings.isEmpty()) {
            log.debug("[VALIDATION] {} sanitised with {} warnings: {}", sanitized.getAsset(), warnings.size(), warnings);
        }

        return ValidationResult.builder()
                .signal(sanitized)
                .warnings(Collections.unmodifiableList(warnings))
                .signalQualityScore(signalQuality(input))
                .marketQualityScore(marketQuality(market))
                .createdAtDefaulted(input.getCreatedAt() == null)
                .build();
    }

    // ======================== FIELD SANITISATION ========================

    private String sanitizeAsset(String asset, List<String> warnings) {
        if (asset == null || asset.isBlank()) {
            warnings.add("asset missing, using " + UNKNOWN_ASSET);
            return UNKNOWN_ASSET;
        }
        return asset.trim().toUpperCase(Locale.ROOT);
    }

    private Direction sanitizeDirection(String raw, List<String> warnings) {
        Direction direction = Direction.parse(raw);
        if (direction == null) {
            warnings.add(raw == null ? "direction missing, using NONE" : "unknown direction '" + raw + "', using NONE");
            return Direction.NONE;
        }
        return direction;
    }

    private QualityTier sanitizeQualityTier(String raw, List<String> warnings) {
        QualityTier tier = QualityTier.parse(raw);
        if (tier == null) {
            warnings.add(raw == null ? "quality tier missing, using MEDIUM"
                    : "unknown quality tier '" + raw + "', using MEDIUM");
            return QualityTier.MEDIUM;
        }
        return tier;
    }

    private double sanitizeConfidence(Double confidence, List<String> warnings) {
        if (confidence == null || confidence.isNaN()) {
            warnings.add("confidence missing, using " + DEFAULT_CONFIDENCE);
            return DEFAULT_CONFIDENCE;
        }
        if (confidence < 0.0 || confidence > 1.0) {
            double clamped = Math.max(0.0, Math.min(1.0, confidence));
            warnings.add("confidence " + confidence + " out of range, clamped to " + clamped);
            return clamped;
        }
        return confidence;
    }

    private Double sanitizePrice(Double price, List<String> warnings) {
        if (price == null) {
            return null;
        }
        if (price.isNaN() || price <= 0.0 || price > MAX_PRICE) {
            warnings.add("price " + price + " out of range, dropped");
            return null;
        }
        return price;
    }

    private Instant now(List<String> warnings) {
        warnings.add("creation time missing, using now");
        return clock.instant();
    }

    private void validateMarket(MarketSnapshot market, List<String> warnings) {
        if (market == null) {
            return;
        }
        if (market.getPrice() != null && market.getPrice() <= 0.0) {
            warnings.add("market price must be positive");
        }
        if (market.getVolume() != null && market.getVolume() < 0.0) {
            warnings.add("market volume must not be negative");
        }
        if (market.getChange24h() != null && Math.abs(market.getChange24h()) > MAX_CHANGE_24H_PCT) {
            warnings.add("24h change " + market.getChange24h() + "% is implausible");
        }
        if (market.getVolatility() != null && (market.getVolatility() < 0.0 || market.getVolatility() > 1.0)) {
            warnings.add("volatility " + market.getVolatility() + " outside [0, 1]");
        }
    }

    // ======================== DATA QUALITY ========================

    static double signalQuality(Signal signal) {
        double score = 1.0;
        if (signal.getAsset() == null || signal.getAsset().isBlank()) score -= CRITICAL_FIELD_PENALTY;
        if (signal.getDirection() == null) score -= CRITICAL_FIELD_PENALTY;
        if (signal.getCreatedAt() == null) score -= CRITICAL_FIELD_PENALTY;
        if (signal.getQualityTier() == null) score -= IMPORTANT_FIELD_PENALTY;
        if (signal.getConfidence() == null) score -= IMPORTANT_FIELD_PENALTY;
        if (signal.getPrice() == null) score -= IMPORTANT_FIELD_PENALTY;
        return Math.max(0.0, score);
    }

    static double marketQuality(MarketSnapshot market) {
        if (market == null) {
            return 1.0 - 4 * MARKET_FIELD_PENALTY;
        }
        double score = 1.0;
        if (market.getPrice() == null) score -= MARKET_FIELD_PENALTY;
        if (market.getVolume() == null) score -= MARKET_FIELD_PENALTY;
        if (market.getChange24h() == null) score -= MARKET_FIELD_PENALTY;
        if (market.getVolatility() == null) score -= MARKET_FIELD_PENALTY;
        return Math.max(0.0, score);
    }
}
