package com.vtb.triage.classification;

import com.vtb.triage.TestFindings;
import com.vtb.triage.config.TriageConfig;
import com.vtb.triage.exceptions.InvalidProfileException;
import com.vtb.triage.models.SeverityLevel;
import com.vtb.triage.normalize.UnrecognizedSeverityPolicy;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProfileFactoryTest {

    private final ClassificationEngine engine = new ClassificationEngine();

    @Test
    void testBrokerProfileFromDefaultConfig() {
        Profile broker = ProfileFactory.fromConfig(TriageConfig.load(), "broker");

        assertEquals("broker", broker.getName());
        assertEquals(List.of("SRE", "Dev", "Database"), broker.getDisplayOrder());
        assertTrue(broker.tracksExploits("SRE"));
        assertFalse(broker.tracksExploits("Dev"));
        assertEquals("Bamboo агент, путь сборочного артефакта", broker.getRules().get(0).description());
    }

    @Test
    void testTriageProfileSplitsDataTierBySubscription() {
        Profile triage = ProfileFactory.fromConfig(TriageConfig.load(), "triage");

        assertEquals(UnrecognizedSeverityPolicy.FOLD_INTO_NONE, triage.getUnrecognizedSeverityPolicy());
        assertEquals("DEV_Application_Dependencies", engine.classify(
            TestFindings.normalized("tableau-srv", "/opt/tableau/conf/server.xml"), triage));
        assertEquals("DEVOPS_Platform_Tooling", engine.classify(
            TestFindings.normalized("bamboo-01", "/usr/lib/libssl.so", "Platinum", SeverityLevel.HIGH, false), triage));
        assertEquals("DB_Production_Assets", engine.classify(
            TestFindings.normalized("pg-main", "/var/lib/pg", "Platinum", SeverityLevel.HIGH, false), triage));
        assertEquals("DB_NonProduction_Assets", engine.classify(
            TestFindings.normalized("pg-test", "/var/lib/pg", "Gold", SeverityLevel.LOW, false), triage));
    }

    @Test
    void testNegatedCondition() {
        Profile profile = ProfileFactory.fromDefinition(parse(String.join("\n",
            "profiles:",
            "  p:",
            "    groups: [Dev, Ops]",
            "    defaultGroup: Dev",
            "    rules:",
            "      - group: Ops",
            "        when:",
            "          - field: LOCATION_PATH",
            "            containsAny: [src]",
            "            negate: true",
            "")).getProfile("p"));

        assertEquals("Ops", engine.classify(TestFindings.normalized("x", "/usr/bin"), profile));
        assertEquals("Dev", engine.classify(TestFindings.normalized("x", "/SRC/main"), profile));
        assertEquals("#1 -> Ops", profile.getRules().get(0).description());
    }

    @Test
    void testRuleWithoutConditionsRejected() {
        TriageConfig config = parse(String.join("\n",
            "profiles:",
            "  p:",
            "    groups: [A, B]",
            "    defaultGroup: A",
            "    rules:",
            "      - group: B",
            ""));

        assertThrows(InvalidProfileException.class, () -> ProfileFactory.fromConfig(config, "p"));
    }

    @Test
    void testUnknownFieldRejected() {
        TriageConfig config = parse(String.join("\n",
            "profiles:",
            "  p:",
            "    groups: [A, B]",
            "    defaultGroup: A",
            "    rules:",
            "      - group: B",
            "        when:",
            "          - field: hostname",
            "            containsAny: [x]",
            ""));

        InvalidProfileException e = assertThrows(InvalidProfileException.class,
            () -> ProfileFactory.fromConfig(config, "p"));
        assertTrue(e.getMessage().contains("hostname"));
    }

    @Test
    void testRuleWithoutGroupRejected() {
        TriageConfig config = parse(String.join("\n",
            "profiles:",
            "  p:",
            "    groups: [A]",
            "    defaultGroup: A",
            "    rules:",
            "      - when:",
            "          - field: assetName",
            "            containsAny: [x]",
            ""));

        assertThrows(InvalidProfileException.class, () -> ProfileFactory.fromConfig(config, "p"));
    }

    @Test
    void testUnknownSeverityPolicyRejected() {
        TriageConfig config = parse(String.join("\n",
            "profiles:",
            "  p:",
            "    groups: [A]",
            "    defaultGroup: A",
            "    unrecognizedSeverity: guess",
            ""));

        assertThrows(InvalidProfileException.class, () -> ProfileFactory.fromConfig(config, "p"));
    }

    private static TriageConfig parse(String yaml) {
        return TriageConfig.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }
}
