package com.xammer.guardrail.config;

import com.xammer.guardrail.domain.FindingType;
import com.xammer.guardrail.domain.RemediationAction;
import com.xammer.guardrail.domain.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structured settings bound from the {@code guardrail.*} namespace.
 * Field initializers carry the shipped defaults so the policy tables are
 * complete even when application.yml only overrides a subset.
 */
@Data
@ConfigurationProperties(prefix = "guardrail")
public class GuardrailProperties {

    private Classification classification = new Classification();
    private Remediation remediation = new Remediation();
    private Hygiene hygiene = new Hygiene();
    private Accounts accounts = new Accounts();
    private Audit audit = new Audit();

    @Data
    public static class Classification {
        /** Tag values marking a resource as production-facing. */
        private List<String> productionMarkers = new ArrayList<>(List.of("production", "prod", "production-facing", "public-facing"));
        /** Tag values marking a resource as internal-only. */
        private List<String> internalMarkers = new ArrayList<>(List.of("internal", "internal-only", "internal-sandbox", "sandbox", "dev", "test"));
    }

    @Data
    public static class Remediation {
        private Map<FindingType, RemediationAction> findingTypes = defaultFindingTypes();
        private Map<RemediationAction, ActionPolicy> actions = defaultActions();
        private Retry retry = new Retry();

        private static Map<FindingType, RemediationAction> defaultFindingTypes() {
            Map<FindingType, RemediationAction> map = new EnumMap<>(FindingType.class);
            map.put(FindingType.PUBLIC_RESOURCE_EXPOSURE, RemediationAction.BLOCK_PUBLIC_ACCESS);
            map.put(FindingType.OVER_PERMISSIVE_POLICY, RemediationAction.REVOKE_OVERPERMISSIVE_STATEMENT);
            map.put(FindingType.UNUSED_ACCESS, RemediationAction.DISABLE_UNUSED_CREDENTIAL);
            map.put(FindingType.KEY_MISUSE, RemediationAction.MANUAL_REVIEW);
            map.put(FindingType.UNRECOGNIZED, RemediationAction.MANUAL_REVIEW);
            return map;
        }

        private static Map<RemediationAction, ActionPolicy> defaultActions() {
            Map<RemediationAction, ActionPolicy> map = new EnumMap<>(RemediationAction.class);
            map.put(RemediationAction.BLOCK_PUBLIC_ACCESS, ActionPolicy.automaticAt(Severity.HIGH));
            map.put(RemediationAction.REVOKE_OVERPERMISSIVE_STATEMENT, ActionPolicy.automaticAt(Severity.HIGH));
            map.put(RemediationAction.DISABLE_UNUSED_CREDENTIAL, ActionPolicy.automaticAt(Severity.HIGH));
            map.put(RemediationAction.MANUAL_REVIEW, new ActionPolicy());
            return map;
        }
    }

    @Data
    public static class ActionPolicy {
        /** Severities at which the action runs without a human. Anything else becomes manual review. */
        private Set<Severity> automaticSeverities = EnumSet.noneOf(Severity.class);

        public static ActionPolicy automaticAt(Severity first, Severity... rest) {
            ActionPolicy policy = new ActionPolicy();
            policy.setAutomaticSeverities(EnumSet.of(first, rest));
            return policy;
        }
    }

    @Data
    public static class Retry {
        private int maxAttempts = 4;
        private Duration initialInterval = Duration.ofMillis(200);
        private double multiplier = 2.0;
        private Duration maxInterval = Duration.ofSeconds(5);
    }

    @Data
    public static class Hygiene {
        private boolean enabled = true;
        /** Read directly by the scheduler; kept here so it shows up in the bound settings. */
        private String cron = "0 0 3 * * *";
        private Duration maxKeyAge = Duration.ofDays(90);
        private int workerPoolSize = 4;
    }

    @Data
    public static class Accounts {
        /** Statically governed accounts. */
        private List<GovernedAccountEntry> governed = new ArrayList<>();
        private Organizations organizations = new Organizations();
    }

    @Data
    public static class GovernedAccountEntry {
        private String accountId;
        private String roleArn;
        private String externalId;
    }

    @Data
    public static class Organizations {
        /** Discover member accounts through AWS Organizations ListAccounts. */
        private boolean discover = false;
        private String roleName = "GuardrailRemediationRole";
        private String externalId;
    }

    @Data
    public static class Audit {
        /** {@code log} or {@code cloudwatch}. */
        private String sink = "log";
        private String logGroup = "/guardrail/remediation-outcomes";
        private String logStreamPrefix = "outcomes";
    }
}
