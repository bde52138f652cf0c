package com.taleforge.engine.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taleforge.core.exception.PatchApplicationException;
import com.taleforge.core.model.CampaignState;
import com.taleforge.core.model.PatchOperation;
import com.taleforge.core.model.StatePatch;
import com.taleforge.core.model.TimeDelta;
import com.taleforge.core.model.UniverseTime;
import com.taleforge.core.model.ValidationResult;
import com.taleforge.engine.state.PatchApplier;
import com.taleforge.engine.time.CalendarService;
import com.taleforge.engine.time.TimeValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks a state patch one operation at a time and then as a set.
 *
 * Per operation: known op, allow-listed path, value in the path's domain,
 * non-negative time deltas. As a set: repeated paths warn, the total clock
 * jump is bounded, and the whole patch must apply cleanly to a copy of the
 * current state. Any error means none of the operations may be applied.
 */
public class PatchValidator {

    private static final Logger log = LoggerFactory.getLogger(PatchValidator.class);

    public static final String OP_REQUIRED = "OP_REQUIRED";
    public static final String UNKNOWN_OP = "UNKNOWN_OP";
    public static final String PATH_REQUIRED = "PATH_REQUIRED";
    public static final String PATH_NOT_ALLOWED = "PATH_NOT_ALLOWED";
    public static final String REMOVE_NOT_ALLOWED = "REMOVE_NOT_ALLOWED";
    public static final String VALUE_REQUIRED = "VALUE_REQUIRED";
    public static final String INVALID_VALUE = "INVALID_VALUE";
    public static final String UNUSUAL_VALUE = "UNUSUAL_VALUE";
    public static final String DUPLICATE_PATH = "DUPLICATE_PATH";
    public static final String PATCH_NOT_APPLICABLE = "PATCH_NOT_APPLICABLE";
    public static final String HP_ABOVE_MAX = "HP_ABOVE_MAX";

    private final ProposalDecoder decoder;
    private final StatePathPolicy policy;
    private final TimeValidator timeValidator;
    private final CalendarService calendarService;
    private final PatchApplier patchApplier;

    public PatchValidator(ProposalDecoder decoder, StatePathPolicy policy, TimeValidator timeValidator,
                          CalendarService calendarService, PatchApplier patchApplier) {
        this.decoder = decoder;
        this.policy = policy;
        this.timeValidator = timeValidator;
        this.calendarService = calendarService;
        this.patchApplier = patchApplier;
    }

    /**
     * Decode and validate a raw patches section against the current state.
     */
    public ValidationResult validate(JsonNode section, CampaignState current) {
        ValidationResult.Builder problems = ValidationResult.builder();
        StatePatch patch = decoder.decodePatch(section, ProposalDecoder.PATCHES, problems);
        return problems.build().merge(validate(patch, current));
    }

    public ValidationResult validate(StatePatch patch, CampaignState current) {
        ValidationResult.Builder result = ValidationResult.builder();
        List<PatchOperation> operations = patch.operations();
        Set<String> seenPaths = new HashSet<>();
        long clockMinutes = 0;
        boolean advancesClock = false;
        boolean clockOverflow = false;

        for (int i = 0; i < operations.size(); i++) {
            PatchOperation operation = operations.get(i);
            String path = pathOf(i);

            if (operation instanceof PatchOperation.AdvanceTime advance) {
                ValidationResult deltaResult = timeValidator.validateDelta(advance.delta(), path + ".value");
                result.merge(deltaResult);
                advancesClock = true;
                if (!deltaResult.valid() || clockOverflow) {
                    continue;
                }
                try {
                    clockMinutes = Math.addExact(clockMinutes,
                        advance.delta().toTotalMinutes(calendarService.calendar()));
                } catch (ArithmeticException e) {
                    result.merge(timeValidator.tooLarge(path + ".value"));
                    clockOverflow = true;
                }
                continue;
            }
            if (operation instanceof PatchOperation.Unrecognized unknown) {
                if (unknown.op() == null) {
                    result.error(path + ".op", OP_REQUIRED, "Patch operation needs an op");
                } else {
                    result.error(path + ".op", UNKNOWN_OP, "Unknown patch op: " + unknown.op());
                }
                continue;
            }

            Optional<StatePathPolicy.Rule> rule = checkPath(operation.path(), path, result);
            if (rule.isEmpty()) {
                continue;
            }
            if (!seenPaths.add(operation.path())) {
                result.warning(path + ".path", DUPLICATE_PATH,
                    "Path written more than once; the last write wins: " + operation.path());
            }

            if (operation instanceof PatchOperation.Replace replace) {
                checkValue(replace.value(), rule.get(), path, result);
            } else if (operation instanceof PatchOperation.Add add) {
                checkValue(add.value(), rule.get(), path, result);
            } else if (operation instanceof PatchOperation.Remove) {
                String template = rule.get().template();
                if (!template.endsWith("{i}") && !template.endsWith("{key}")) {
                    result.error(path + ".op", REMOVE_NOT_ALLOWED,
                        "Only list elements and keyed entries can be removed: " + operation.path());
                }
            }
        }

        if (advancesClock && !clockOverflow) {
            result.merge(timeValidator.validateAdvance(current.universeTime(), TimeDelta.ofMinutes(clockMinutes),
                ProposalDecoder.PATCHES));
        }

        if (!result.hasErrors()) {
            dryRun(operations, current, result);
        }
        return result.build();
    }

    private Optional<StatePathPolicy.Rule> checkPath(String target, String path, ValidationResult.Builder result) {
        if (target == null || target.isBlank()) {
            result.error(path + ".path", PATH_REQUIRED, "Patch operation needs a path");
            return Optional.empty();
        }
        Optional<StatePathPolicy.Rule> rule = policy.ruleFor(target);
        if (rule.isEmpty()) {
            result.error(path + ".path", PATH_NOT_ALLOWED, "Path is not a mutable state location: " + target);
        }
        return rule;
    }

    private static void checkValue(JsonNode value, StatePathPolicy.Rule rule, String path,
                                   ValidationResult.Builder result) {
        if (value == null) {
            result.error(path + ".value", VALUE_REQUIRED, "Patch operation needs a value");
            return;
        }
        ValueDomain domain = rule.domain();
        if (!domain.accepts(value)) {
            result.error(path + ".value", INVALID_VALUE, String.format(
                "%s must be %s", rule.template(), domain.describe()));
        } else if (domain.isUnusual(value)) {
            result.warning(path + ".value", UNUSUAL_VALUE, String.format(
                "Unusual value '%s' for %s", value.asText(), rule.template()));
        }
    }

    /**
     * Apply every operation to a copy of the state; the first failure is an error.
     */
    private void dryRun(List<PatchOperation> operations, CampaignState current, ValidationResult.Builder result) {
        ObjectNode document = current.mutableDocument();
        UniverseTime time = current.universeTime();
        for (int i = 0; i < operations.size(); i++) {
            try {
                time = patchApplier.applyOperation(document, time, operations.get(i));
            } catch (PatchApplicationException e) {
                log.debug("Dry run failed at operation {}: {}", i, e.getMessage());
                result.error(pathOf(i), PATCH_NOT_APPLICABLE, e.getMessage());
                return;
            }
        }
        JsonNode hp = document.path(CampaignState.PARTY).path("player").path("hp");
        if (hp.path("current").isIntegralNumber() && hp.path("max").isIntegralNumber()
            && hp.path("current").asInt() > hp.path("max").asInt()) {
            result.warning(ProposalDecoder.PATCHES, HP_ABOVE_MAX, String.format(
                "hp current %d would exceed max %d", hp.path("current").asInt(), hp.path("max").asInt()));
        }
    }

    private static String pathOf(int index) {
        return ProposalDecoder.PATCHES + "[" + index + "]";
    }
}
