package com.taleforge.engine.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taleforge.core.model.CampaignState;
import com.taleforge.core.model.ValidationResult;
import com.taleforge.engine.EngineFixture;
import com.taleforge.engine.state.InitialStateFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Narrator output validation")
class NarratorOutputValidatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final EngineFixture fixture = new EngineFixture();
    private final ProposalDecoder decoder = new ProposalDecoder();
    private final CampaignState state = new InitialStateFactory().create(fixture.newCampaign(3));

    private ValidationResult validate(String payload) throws Exception {
        NarratorProposal proposal = decoder.decode((ObjectNode) mapper.readTree(payload));
        return fixture.validator.validate(proposal, state);
    }

    @Test
    @DisplayName("An empty payload is valid")
    void emptinessIsNotAnError() throws Exception {
        ValidationResult result = validate("{\"roll_requests\": [], \"patches\": [], \"lore_deltas\": []}");

        assertTrue(result.valid());
        assertTrue(validate("{}").valid());
        assertTrue(fixture.validator.validate(NarratorProposal.EMPTY, state).valid());
    }

    @Test
    @DisplayName("Errors from all three parts are reported together")
    void problemsFromEveryPartAccumulate() throws Exception {
        ValidationResult result = validate("""
            {
              "roll_requests": [{"id": "r1", "type": "ability_check", "ability": "dex", "dc": 100}],
              "patches": [{"op": "replace", "path": "/rules/content_rating", "value": "R"}],
              "lore_deltas": [{"type": "soft_lore", "text": ""}]
            }
            """);

        assertFalse(result.valid());
        assertTrue(result.hasErrorCode(RollRequestValidator.INVALID_DC));
        assertTrue(result.hasErrorCode(PatchValidator.PATH_NOT_ALLOWED));
        assertTrue(result.hasErrorCode(LoreDeltaValidator.TEXT_REQUIRED));
    }

    @Test
    void sectionShapeErrorsAreIncluded() throws Exception {
        ValidationResult result = validate("{\"roll_requests\": {\"id\": \"r1\"}, \"patches\": \"none\"}");

        assertFalse(result.valid());
        assertEquals(2, result.errors().stream()
            .filter(e -> e.code().equals(ProposalDecoder.NOT_A_LIST)).count());
    }

    @Test
    void warningsDoNotBlock() throws Exception {
        ValidationResult result = validate("""
            {"lore_deltas": [{"type": "hard_canon", "text": "The bridge was built by giants."}]}
            """);

        assertTrue(result.valid());
        assertTrue(result.hasWarningCode(LoreDeltaValidator.HARD_CANON));
    }
}
