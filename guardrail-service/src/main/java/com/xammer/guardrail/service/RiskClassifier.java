package com.xammer.guardrail.service;

import com.xammer.guardrail.config.GuardrailProperties;
import com.xammer.guardrail.domain.Classification;
import com.xammer.guardrail.domain.Exposure;
import com.xammer.guardrail.domain.Finding;
import com.xammer.guardrail.domain.FindingType;
import com.xammer.guardrail.domain.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pure, deterministic severity assignment. The only inputs are the finding's
 * type and the exposure derived from its tags.
 */
@Service
public class RiskClassifier {

    private static final Logger logger = LoggerFactory.getLogger(RiskClassifier.class);

    private static final List<String> TAG_ATTRIBUTES = List.of("tagged", "environment", "env", "Environment");
    private static final List<String> TAG_KEYS = List.of("environment", "Environment", "env", "Env", "stage", "Stage");

    private final SeverityDecisionTable table;
    private final Set<String> productionMarkers;
    private final Set<String> internalMarkers;

    @Autowired
    public RiskClassifier(GuardrailProperties properties) {
        this(SeverityDecisionTable.defaults(),
                properties.getClassification().getProductionMarkers(),
                properties.getClassification().getInternalMarkers());
    }

    public RiskClassifier(SeverityDecisionTable table, Collection<String> productionMarkers,
                          Collection<String> internalMarkers) {
        this.table = table;
        this.productionMarkers = lowerCase(productionMarkers);
        this.internalMarkers = lowerCase(internalMarkers);
    }

    public Classification classify(Finding finding) {
        Exposure exposure = exposureOf(finding.getRawAttributes());
        Severity severity = table.severityFor(finding.getType(), exposure);
        String reason;
        if (finding.getType() == FindingType.UNRECOGNIZED) {
            reason = Classification.UNCLASSIFIED_TYPE;
            logger.warn("Finding {} has unrecognized type '{}', classifying as {} for manual review",
                    finding.getId(), finding.getRawType(), severity);
        } else {
            reason = finding.getType().name().toLowerCase(Locale.ROOT) + "/" + exposure.name().toLowerCase(Locale.ROOT);
        }
        logger.debug("Finding {} classified {} ({})", finding.getId(), severity, reason);
        return new Classification(finding, exposure, severity, reason);
    }

    /**
     * Production markers win over internal ones when a resource carries both.
     */
    Exposure exposureOf(Map<String, Object> attributes) {
        List<String> tagValues = tagValues(attributes);
        if (tagValues.stream().anyMatch(productionMarkers::contains)) {
            return Exposure.PRODUCTION;
        }
        if (tagValues.stream().anyMatch(internalMarkers::contains)) {
            return Exposure.INTERNAL;
        }
        return Exposure.UNSPECIFIED;
    }

    private static List<String> tagValues(Map<String, Object> attributes) {
        List<String> values = new ArrayList<>();
        for (String name : TAG_ATTRIBUTES) {
            collect(attributes.get(name), values);
        }
        Object tags = attributes.get("tags");
        if (tags == null) {
            tags = attributes.get("Tags");
        }
        if (tags instanceof Map) {
            Map<?, ?> tagMap = (Map<?, ?>) tags;
            for (String key : TAG_KEYS) {
                collect(tagMap.get(key), values);
            }
        } else if (tags instanceof Collection) {
            // [{"Key": "environment", "Value": "prod"}, ...] as returned by AWS tagging APIs
            for (Object tag : (Collection<?>) tags) {
                if (tag instanceof Map) {
                    Map<?, ?> pair = (Map<?, ?>) tag;
                    Object key = pair.containsKey("Key") ? pair.get("Key") : pair.get("key");
                    if (key != null && TAG_KEYS.contains(key.toString())) {
                        collect(pair.containsKey("Value") ? pair.get("Value") : pair.get("value"), values);
                    }
                }
            }
        }
        return values;
    }

    private static void collect(Object value, List<String> into) {
        if (value instanceof Collection) {
            ((Collection<?>) value).forEach(item -> collect(item, into));
        } else if (value != null) {
            into.add(value.toString().trim().toLowerCase(Locale.ROOT));
        }
    }

    private static Set<String> lowerCase(Collection<String> markers) {
        return markers.stream()
                .map(marker -> marker.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }
}
