package com.vtb.triage.normalize;

import com.vtb.triage.models.FindingField;
import com.vtb.triage.models.FindingRecord;
import com.vtb.triage.models.NormalizedRecord;
import com.vtb.triage.models.SeverityLevel;
import com.vtb.triage.validation.ResolvedFields;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecordNormalizerTest {

    private final RecordNormalizer normalizer = new RecordNormalizer(
        new SeverityNormalizer(List.of("none", "info"), UnrecognizedSeverityPolicy.PASS_THROUGH),
        new AgeCalculator(Clock.fixed(Instant.parse("2025-09-11T00:00:00Z"), ZoneOffset.UTC)));

    private final ResolvedFields fields = ResolvedFields.of(Map.of(
        FindingField.ASSET_NAME, "AssetName",
        FindingField.LOCATION_PATH, "Location Path",
        FindingField.SEVERITY, "VendorSeverity",
        FindingField.SUBSCRIPTION, "SubscriptionName",
        FindingField.EXPLOIT_FLAG, "HasExploit",
        FindingField.FIRST_DETECTED, "FirstDetected"));

    @Test
    void testMatchingFieldsLowerCasedAndTrimmed() {
        Map<String, String> values = new HashMap<>();
        values.put("AssetName", "  BambooAgent1 ");
        values.put("Location Path", "/Repo/.M2/settings.xml");
        values.put("VendorSeverity", "HIGH");
        values.put("SubscriptionName", "Platinum-Prod");

        NormalizedRecord record = normalizer.normalize(new FindingRecord(1, values), fields);

        assertEquals("bambooagent1", record.getAssetName());
        assertEquals("/repo/.m2/settings.xml", record.getLocationPath());
        assertEquals("platinum-prod", record.getSubscription());
        assertEquals(SeverityLevel.HIGH, record.getSeverity());
        assertEquals("HIGH", record.getRawSeverity());
    }

    @Test
    void testMissingValuesFilled() {
        NormalizedRecord record = normalizer.normalize(new FindingRecord(1, new HashMap<>()), fields);

        assertEquals("", record.getAssetName());
        assertEquals("", record.getLocationPath());
        assertEquals("", record.getSubscription());
        assertEquals(SeverityLevel.NONE, record.getSeverity());
        assertEquals("None", record.getSeverityLabel());
        assertFalse(record.isExploitKnown());
        assertNull(record.getAgeDays());
    }

    @Test
    void testRawRecordPreserved() {
        Map<String, String> values = new HashMap<>();
        values.put("AssetName", "BambooAgent1");
        values.put("VendorSeverity", "info");
        FindingRecord raw = new FindingRecord(7, values);

        NormalizedRecord record = normalizer.normalize(raw, fields);

        assertSame(raw, record.getSource());
        assertEquals("BambooAgent1", record.getSource().get("AssetName"));
        assertEquals("info", record.getSource().get("VendorSeverity"));
    }

    @Test
    void testExploitFlagValues() {
        assertTrue(RecordNormalizer.isExploitKnown("Yes"));
        assertTrue(RecordNormalizer.isExploitKnown(" TRUE "));
        assertFalse(RecordNormalizer.isExploitKnown("no"));
        assertFalse(RecordNormalizer.isExploitKnown("1"));
        assertFalse(RecordNormalizer.isExploitKnown(null));
    }

    @Test
    void testAgeComputedWhenDetectionColumnPresent() {
        Map<String, String> values = new HashMap<>();
        values.put("FirstDetected", "2025-09-01T00:00:00Z");

        NormalizedRecord record = normalizer.normalize(new FindingRecord(1, values), fields);

        assertEquals(10L, record.getAgeDays());
    }
}
