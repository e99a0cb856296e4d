package com.questrail.pvl.validate;

import com.questrail.pvl.codec.EncodingRejectedException;
import com.questrail.pvl.codec.LabelEncoders;
import com.questrail.pvl.model.LabelMapping;
import com.questrail.pvl.validate.observability.RecordingValidationObservabilitySink;
import com.questrail.pvl.validate.observability.ValidationFailureEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class LabelValidatorTest
{
    private static final Instant NOW = Instant.parse("2024-03-01T00:00:00Z");

    private RecordingValidationObservabilitySink observability;

    @BeforeEach
    void setUp()
    {
        observability = new RecordingValidationObservabilitySink();
    }

    /** Loader that "parses" any text into a label holding the text itself. */
    private static LabelLoader echoLoader()
    {
        return text -> LabelMapping.builder().put("TEXT", text).build();
    }

    private static LabelLoader rejectingLoader()
    {
        return text -> {
            throw new LabelLoadException("unexpected token at line 1");
        };
    }

    private LabelValidator validator(List<LabelProfile> profiles)
    {
        return new LabelValidator(profiles, observability, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void loadsAndEncodes_forEveryAcceptingProfile()
    {
        LabelValidator v = validator(List.of(
                new LabelProfile("PDS3", echoLoader(), LabelEncoders.pds3()),
                new LabelProfile("PVL", echoLoader(), LabelEncoders.pvl())));

        FileValidation result = v.validate("a.lbl", "PLAIN");

        assertEquals(List.of("PDS3", "PVL"), List.copyOf(result.outcomes().keySet()));
        assertEquals(ProfileOutcome.loaded(true), result.outcome("PDS3"));
        assertEquals(ProfileOutcome.loaded(true), result.outcome("PVL"));
        assertTrue(observability.getLoadFailures().isEmpty());
        assertTrue(observability.getEncodeFailures().isEmpty());
    }

    @Test
    void encodeFailureIsRecordedPerProfile()
    {
        LabelValidator v = validator(List.of(
                new LabelProfile("PDS3", echoLoader(), LabelEncoders.pds3()),
                new LabelProfile("PVL", echoLoader(), LabelEncoders.pvl())));

        FileValidation result = v.validate("quoted.lbl", "say \"hi\"");

        assertEquals(ProfileOutcome.loaded(false), result.outcome("PDS3"));
        assertEquals(ProfileOutcome.loaded(true), result.outcome("PVL"));

        List<ValidationFailureEvent> failures = observability.getEncodeFailures();
        assertEquals(1, failures.size());
        assertEquals("PDS3", failures.get(0).profile());
        assertEquals("quoted.lbl", failures.get(0).file());
        assertEquals(NOW, failures.get(0).timestamp());
        assertInstanceOf(EncodingRejectedException.class, failures.get(0).cause());
    }

    @Test
    void loadFailureSkipsEncoding()
    {
        LabelValidator v = validator(List.of(
                new LabelProfile("ODL", rejectingLoader(), LabelEncoders.pds3()),
                new LabelProfile("Omni", echoLoader(), LabelEncoders.pvl())));

        FileValidation result = v.validate("b.lbl", "X");

        assertEquals(ProfileOutcome.notLoaded(), result.outcome("ODL"));
        assertFalse(result.outcome("ODL").encoded());
        assertEquals(ProfileOutcome.loaded(true), result.outcome("Omni"));

        assertEquals(1, observability.getLoadFailures().size());
        assertEquals("ODL", observability.getLoadFailures().get(0).profile());
        assertTrue(observability.getEncodeFailures().isEmpty());
    }

    @Test
    void validatedFilesRenderAsReportTable()
    {
        LabelValidator v = validator(List.of(
                new LabelProfile("PDS3", echoLoader(), LabelEncoders.pds3()),
                new LabelProfile("PVL", echoLoader(), LabelEncoders.pvl())));

        List<FileValidation> results = List.of(
                v.validate("a", "x\"y"),
                v.validate("b", "ok"));

        String rule = "----" + "-+-" + "---------" + "-+-" + "---------";
        String expected = String.join("\n",
                rule,
                "File" + " | " + "  PDS3   " + " | " + "   PVL   ",
                rule,
                "a   " + " | " + " L   No E" + " | " + " L    E  ",
                "b   " + " | " + " L    E  " + " | " + " L    E  ");

        assertEquals(List.of("PDS3", "PVL"), v.profileNames());
        assertEquals(expected, ValidationReport.render(results, v.profileNames()));
    }

    @Test
    void unexpectedLoaderDefectsPropagate()
    {
        LabelValidator v = validator(List.of(new LabelProfile("PVL",
                text -> { throw new IllegalStateException("bug"); },
                LabelEncoders.pvl())));

        assertThrows(IllegalStateException.class, () -> v.validate("c.lbl", "X"));
    }

    @Test
    void rejectsEmptyOrDuplicateProfiles()
    {
        assertThrows(IllegalArgumentException.class, () -> new LabelValidator(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new LabelValidator(List.of(
                new LabelProfile("PVL", echoLoader(), LabelEncoders.pvl()),
                new LabelProfile("PVL", echoLoader(), LabelEncoders.cube()))));
    }

    @Test
    void profileOutcomeCanNotBeEncodedWithoutLoading()
    {
        assertThrows(IllegalArgumentException.class, () -> new ProfileOutcome(false, true));
    }
}
