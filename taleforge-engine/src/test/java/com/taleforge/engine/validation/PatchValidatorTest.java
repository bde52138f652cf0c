package com.taleforge.engine.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taleforge.core.model.CampaignState;
import com.taleforge.core.model.ValidationResult;
import com.taleforge.engine.EngineFixture;
import com.taleforge.engine.state.InitialStateFactory;
import com.taleforge.engine.state.PatchApplier;
import com.taleforge.engine.time.CalendarService;
import com.taleforge.engine.time.TimeValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Patch validation")
class PatchValidatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private PatchValidator validator;
    private CampaignState state;

    @BeforeEach
    void setUp() {
        EngineFixture fixture = new EngineFixture();
        CalendarService calendar = fixture.calendar;
        validator = new PatchValidator(new ProposalDecoder(), StatePathPolicy.DEFAULT,
            new TimeValidator(calendar, 100), calendar, new PatchApplier(calendar));
        state = new InitialStateFactory().create(fixture.newCampaign(7));
    }

    private ValidationResult validate(String patches) throws Exception {
        return validator.validate(mapper.readTree(patches), state);
    }

    @Nested
    @DisplayName("single operations")
    class SingleOperations {

        @Test
        void replaceHitPoints() throws Exception {
            ValidationResult result = validate("""
                [{"op": "replace", "path": "/party/player/hp/current", "value": 4}]
                """);

            assertTrue(result.valid(), () -> result.errors().toString());
        }

        @Test
        void negativeHitPointsAreRejected() throws Exception {
            ValidationResult result = validate("""
                [{"op": "replace", "path": "/party/player/hp/current", "value": -1}]
                """);

            assertTrue(result.hasErrorCode(PatchValidator.INVALID_VALUE));
            assertEquals("patches[0].value", result.errors().get(0).path());
        }

        @Test
        void conditionsMustBeAListOfStrings() throws Exception {
            assertTrue(validate("""
                [{"op": "replace", "path": "/party/player/conditions", "value": "poisoned"}]
                """).hasErrorCode(PatchValidator.INVALID_VALUE));
            assertTrue(validate("""
                [{"op": "replace", "path": "/party/player/conditions", "value": ["poisoned", "prone"]}]
                """).valid());
        }

        @Test
        void pathOutsideAllowListIsRejected() throws Exception {
            ValidationResult result = validate("""
                [{"op": "replace", "path": "/party/player/ability_scores/str", "value": 20}]
                """);

            assertTrue(result.hasErrorCode(PatchValidator.PATH_NOT_ALLOWED));
        }

        @Test
        void unknownOpAndMissingFields() throws Exception {
            ValidationResult result = validate("""
                [
                  {"op": "merge", "path": "/world/location_id", "value": "x"},
                  {"path": "/world/location_id", "value": "x"},
                  {"op": "replace", "value": "x"},
                  {"op": "replace", "path": "/world/location_id"}
                ]
                """);

            assertTrue(result.hasErrorCode(PatchValidator.UNKNOWN_OP));
            assertTrue(result.hasErrorCode(PatchValidator.OP_REQUIRED));
            assertTrue(result.hasErrorCode(PatchValidator.PATH_REQUIRED));
            assertTrue(result.hasErrorCode(PatchValidator.VALUE_REQUIRED));
        }

        @Test
        void removeOnlyOnListElementsAndKeys() throws Exception {
            assertTrue(validate("""
                [{"op": "remove", "path": "/party/player/conditions"}]
                """).hasErrorCode(PatchValidator.REMOVE_NOT_ALLOWED));
            assertTrue(validate("""
                [{"op": "add", "path": "/world/global_flags/bell_rung", "value": true},
                 {"op": "remove", "path": "/world/global_flags/bell_rung"}]
                """).valid());
        }

        @Test
        void unusualNpcStatusWarns() throws Exception {
            ValidationResult result = validate("""
                [{"op": "replace", "path": "/world/npcs/innkeeper/status", "value": "petrified"}]
                """);

            assertTrue(result.valid());
            assertTrue(result.hasWarningCode(PatchValidator.UNUSUAL_VALUE));
        }
    }

    @Nested
    @DisplayName("time")
    class Time {

        @Test
        void advanceTimeNeedsNonNegativeDelta() throws Exception {
            ValidationResult result = validate("""
                [{"op": "advance_time", "value": {"hours": -2}}]
                """);

            assertTrue(result.hasErrorCode(TimeValidator.NEGATIVE_TIME_DELTA));
        }

        @Test
        void shortAdvanceIsClean() throws Exception {
            ValidationResult result = validate("""
                [{"op": "advance_time", "value": {"hours": 2, "minutes": 30}}]
                """);

            assertTrue(result.valid());
            assertFalse(result.hasWarnings());
        }

        @Test
        void jumpsOverAMonthWarn() throws Exception {
            ValidationResult result = validate("""
                [{"op": "advance_time", "value": {"days": 20}},
                 {"op": "advance_time", "value": {"days": 20}}]
                """);

            assertTrue(result.valid());
            assertTrue(result.hasWarningCode(TimeValidator.SIGNIFICANT_TIME_JUMP));
        }

        @Test
        void jumpsBeyondLimitAreErrors() throws Exception {
            ValidationResult result = validate("""
                [{"op": "advance_time", "value": {"years": 101}}]
                """);

            assertTrue(result.hasErrorCode(TimeValidator.TIME_JUMP_TOO_LARGE));
        }

        @Test
        void deltaTooLargeToCountIsRejected() throws Exception {
            ValidationResult result = validate("""
                [{"op": "advance_time", "value": {"years": 35096000000000}}]
                """);

            assertFalse(result.valid());
            assertTrue(result.hasErrorCode(TimeValidator.TIME_JUMP_TOO_LARGE));
            assertEquals("patches[0].value", result.errors().get(0).path());
        }

        @Test
        void deltasWhoseSumOverflowsAreRejected() throws Exception {
            ValidationResult result = validate("""
                [{"op": "advance_time", "value": {"years": 9000000000000}},
                 {"op": "advance_time", "value": {"years": 9000000000000}}]
                """);

            assertTrue(result.hasErrorCode(TimeValidator.TIME_JUMP_TOO_LARGE));
            assertEquals("patches[1].value", result.errors().get(0).path());
        }

        @Test
        void yearBeyondTheClockIsRejected() throws Exception {
            ValidationResult result = validate("""
                [{"op": "advance_time", "value": {"years": 1000000000000}}]
                """);

            assertTrue(result.hasErrorCode(TimeValidator.TIME_JUMP_TOO_LARGE));
            assertFalse(result.hasErrorCode(TimeValidator.TIME_REGRESSION));
        }

        @Test
        void unknownDeltaKeysAreRejected() throws Exception {
            ValidationResult result = validate("""
                [{"op": "advance_time", "value": {"weeks": 1}}]
                """);

            assertTrue(result.hasErrorCode(ProposalDecoder.INVALID_TIME_DELTA));
        }
    }

    @Nested
    @DisplayName("the patch as a set")
    class AsASet {

        @Test
        void duplicatePathsWarnAndLastWriteWins() throws Exception {
            ValidationResult result = validate("""
                [{"op": "replace", "path": "/world/location_id", "value": "mill"},
                 {"op": "replace", "path": "/world/location_id", "value": "bridge"}]
                """);

            assertTrue(result.valid());
            assertTrue(result.hasWarningCode(PatchValidator.DUPLICATE_PATH));
        }

        @Test
        void operationThatCannotApplyFailsTheWholePatch() throws Exception {
            ValidationResult result = validate("""
                [{"op": "replace", "path": "/world/location_id", "value": "mill"},
                 {"op": "replace", "path": "/party/player/conditions/3", "value": "prone"}]
                """);

            assertFalse(result.valid());
            assertTrue(result.hasErrorCode(PatchValidator.PATCH_NOT_APPLICABLE));
            assertEquals("patches[1]", result.errors().get(0).path());
            // the validated state itself is untouched
            assertEquals("millbrook", state.world().path("location_id").asText());
        }

        @Test
        void hitPointsAboveMaximumWarn() throws Exception {
            ValidationResult result = validate("""
                [{"op": "replace", "path": "/party/player/hp/current", "value": 50}]
                """);

            assertTrue(result.valid());
            assertTrue(result.hasWarningCode(PatchValidator.HP_ABOVE_MAX));
        }

        @Test
        void emptyPatchIsValid() throws Exception {
            assertTrue(validate("[]").valid());
        }
    }
}
