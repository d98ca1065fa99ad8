package com.growpad.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.growpad.core.approval.ApprovalNotifier;
import com.growpad.core.events.EventBus;
import com.growpad.core.events.RunEvent;
import com.growpad.core.evidence.EvidenceRenderer;
import com.growpad.core.evidence.EvidenceReport;
import com.growpad.core.evidence.EvidenceValidator;
import com.growpad.core.generation.ArtifactGenerator;
import com.growpad.core.llm.GenerationParseException;
import com.growpad.core.llm.GenerationUnavailableException;
import com.growpad.core.logging.MdcContext;
import com.growpad.core.metrics.GrowpadMetrics;
import com.growpad.core.model.ApprovalDecision;
import com.growpad.core.model.EvidenceMap;
import com.growpad.core.model.FailureCause;
import com.growpad.core.model.FeatureCandidate;
import com.growpad.core.model.FeatureChoice;
import com.growpad.core.model.Run;
import com.growpad.core.model.RunStatus;
import com.growpad.core.model.StageId;
import com.growpad.core.model.StageOutcome;
import com.growpad.core.model.StageRecord;
import com.growpad.core.model.TicketPlan;
import com.growpad.core.model.Workspace;
import com.growpad.core.model.WorkspaceMode;
import com.growpad.core.packaging.ArtifactPackager;
import com.growpad.core.packaging.ArtifactStages;
import com.growpad.core.patch.PatchApplier;
import com.growpad.core.patch.PatchResult;
import com.growpad.core.repo.TargetRepository;
import com.growpad.core.schema.SchemaValidationException;
import com.growpad.core.schema.SchemaValidator;
import com.growpad.core.store.RunStore;
import com.growpad.core.store.WorkspaceStore;
import com.growpad.core.verify.VerificationProperties;
import com.growpad.core.verify.VerificationResult;
import com.growpad.core.verify.VerificationRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * The stage sequence of one run, executed on the run's worker thread.
 * <p>
 * {@code INTAKE → SYNTHESIZE → SELECT_FEATURE → GENERATE_PRD → GENERATE_DESIGN →
 * [AWAITING_APPROVAL] → GENERATE_TICKETS → IMPLEMENT → VERIFY → (SELF_HEAL → VERIFY)* → EXPORT}
 * <p>
 * Every state change goes through {@link RunStore#update}, so selections, approvals and
 * cancellations written by other threads are never overwritten. A cancelled run is noticed
 * on the next update and at every gate poll.
 */
@Component
public class RunPipeline {

    private static final Logger log = LoggerFactory.getLogger(RunPipeline.class);

    static final String CANCELLED_ERROR = "cancelled";
    static final String VERIFICATION_FAILED = "verification failed";

    static final String FEATURE_SELECTION_REQUIRED = "feature_selection_required";
    static final String RUN_STARTED = "run_started";
    static final String RUN_COMPLETED = "run_completed";
    static final String RUN_FAILED = "run_failed";
    static final String RUN_CANCELLED = "run_cancelled";

    private final RunStore store;
    private final WorkspaceStore workspaces;
    private final EventBus eventBus;
    private final EvidenceValidator evidenceValidator;
    private final EvidenceRenderer evidenceRenderer;
    private final ArtifactGenerator generator;
    private final SchemaValidator schemaValidator;
    private final TargetRepository repository;
    private final PatchApplier patchApplier;
    private final VerificationRunner verificationRunner;
    private final VerificationProperties verificationProperties;
    private final ArtifactPackager packager;
    private final ApprovalNotifier approvalNotifier;
    private final GrowpadMetrics metrics;
    private final EngineProperties properties;

    public RunPipeline(RunStore store, WorkspaceStore workspaces, EventBus eventBus,
                       EvidenceValidator evidenceValidator, EvidenceRenderer evidenceRenderer,
                       ArtifactGenerator generator, SchemaValidator schemaValidator,
                       TargetRepository repository, PatchApplier patchApplier,
                       VerificationRunner verificationRunner, VerificationProperties verificationProperties,
                       ArtifactPackager packager, ApprovalNotifier approvalNotifier,
                       GrowpadMetrics metrics, EngineProperties properties) {
        this.store = store;
        this.workspaces = workspaces;
        this.eventBus = eventBus;
        this.evidenceValidator = evidenceValidator;
        this.evidenceRenderer = evidenceRenderer;
        this.generator = generator;
        this.schemaValidator = schemaValidator;
        this.repository = repository;
        this.patchApplier = patchApplier;
        this.verificationRunner = verificationRunner;
        this.verificationProperties = verificationProperties;
        this.packager = packager;
        this.approvalNotifier = approvalNotifier;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * Runs the whole pipeline. Never throws: every failure ends in a terminal,
     * persisted status.
     */
    public void execute(String runId, RunContext context) {
        Execution ex = new Execution(runId, context);
        try {
            Run initial = store.load(runId);
            MdcContext.setRun(runId, initial.getWorkspaceId());
            ex.workspace = workspaces.load(initial.getWorkspaceId());
            mutate(ex, run -> {
                run.transitionTo(RunStatus.RUNNING);
                run.getTimestamps().put(Run.STARTED_AT, Instant.now());
            });
            emit(ex, RunEvent.of(null, RUN_STARTED, "running", null, null));
            log.info("Run {} started for workspace {}", runId, initial.getWorkspaceId());

            intake(ex, initial);
            synthesize(ex, initial.getGoalStatement());
            selectFeature(ex);
            generatePrd(ex, initial.getGoalStatement());
            generateDesign(ex);
            if (ex.workspace.approvalWorkflowEnabled()) {
                awaitApproval(ex);
            }
            generateTickets(ex);
            implement(ex);
            VerificationResult result = verifyAndHeal(ex);
            export(ex, result);
        } catch (PipelineException e) {
            fail(ex, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(ex, new PipelineException(FailureCause.INFRASTRUCTURE, "Run worker interrupted", e));
        } catch (RuntimeException e) {
            fail(ex, new PipelineException(classify(e), describe(e), e));
        } finally {
            if (ex.lease != null) {
                ex.lease.close();
            }
            MdcContext.clear();
        }
    }

    // --- stages ---

    private void intake(Execution ex, Run initial) {
        beginStage(ex, StageId.INTAKE);
        String dir = initial.getEvidenceDir();
        ex.evidenceDir = Path.of(dir == null || dir.isBlank() ? properties.getSampleEvidenceDir() : dir);
        EvidenceReport report = evidenceValidator.validate(ex.evidenceDir);
        ex.evidenceFiles = report.files();
        String path = store.writeJsonArtifact(ex.runId, "intake-report.json", report);
        mutate(ex, run -> {
            run.getOutputsIndex().put("intake_report", path);
            run.setStackDetected(report.stackDetected());
        });
        if (!report.valid()) {
            List<String> problems = new ArrayList<>(report.errors());
            report.missingFields().forEach(m -> problems.add("missing " + m));
            throw new PipelineException(FailureCause.VALIDATION,
                    "Evidence validation failed: " + String.join("; ", problems));
        }
        log.info("Evidence accepted with quality score {} (stack {})", report.qualityScore(), report.stackDetected());
        completeStage(ex, StageOutcome.DONE, null);
    }

    private void synthesize(Execution ex, String goal) {
        beginStage(ex, StageId.SYNTHESIZE);
        String rendered = evidenceRenderer.render(ex.evidenceDir, ex.evidenceFiles);
        JsonNode raw = generator.synthesize(rendered, goal, ex.context.trace());
        EvidenceMap map = schemaValidator.evidenceMap(raw);
        ex.evidenceMap = map;
        String path = store.writeJsonArtifact(ex.runId, "evidence-map.json", map);
        mutate(ex, run -> {
            run.setTopFeatures(map.topFeatures());
            run.getOutputsIndex().put("evidence_map", path);
        });
        completeStage(ex, StageOutcome.DONE, null);
    }

    private void selectFeature(Execution ex) throws InterruptedException {
        beginStage(ex, StageId.SELECT_FEATURE);
        Run run = store.load(ex.runId);
        List<FeatureCandidate> candidates = ex.evidenceMap.topFeatures();
        int index;
        String selectedBy;
        if (run.getSelectedFeatureIndex() != null) {
            index = clamp(run.getSelectedFeatureIndex(), candidates.size());
            selectedBy = "request";
        } else if (run.isFastMode()) {
            index = 0;
            selectedBy = "auto";
        } else {
            emit(ex, RunEvent.of(StageId.SELECT_FEATURE, FEATURE_SELECTION_REQUIRED, "waiting", null, null));
            log.info("Waiting up to {} for feature selection", properties.getFeatureSelectionTimeout());
            index = awaitFeatureSelection(ex, candidates.size());
            selectedBy = "user";
        }

        FeatureCandidate chosen = candidates.get(index);
        ex.feature = chosen;
        ex.evidenceMap = ex.evidenceMap.withFeatureChoice(new FeatureChoice(index, chosen.feature(), selectedBy));

        Map<String, Object> selection = new LinkedHashMap<>();
        selection.put("selected_index", index);
        selection.put("selected_by", selectedBy);
        selection.put("feature", chosen);
        String selectionPath = store.writeJsonArtifact(ex.runId, "selected-feature.json", selection);
        String mapPath = store.writeJsonArtifact(ex.runId, "evidence-map.json", ex.evidenceMap);
        mutate(ex, r -> {
            r.setSelectedFeatureIndex(index);
            r.setSelectedFeature(chosen.feature());
            r.getOutputsIndex().put("selected_feature", selectionPath);
            r.getOutputsIndex().put("evidence_map", mapPath);
        });
        log.info("Selected feature {} '{}' ({})", index, chosen.feature(), selectedBy);
        completeStage(ex, StageOutcome.DONE, null);
    }

    private int awaitFeatureSelection(Execution ex, int candidates) throws InterruptedException {
        Instant deadline = Instant.now().plus(properties.getFeatureSelectionTimeout());
        while (true) {
            long seen = ex.context.version();
            Run run = store.load(ex.runId);
            requireNotCancelled(run);
            if (run.getSelectedFeatureIndex() != null) {
                return clamp(run.getSelectedFeatureIndex(), candidates);
            }
            Duration remaining = Duration.between(Instant.now(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                throw new PipelineException(FailureCause.FEATURE_SELECTION_TIMEOUT,
                        "Timed out waiting for feature selection after " + properties.getFeatureSelectionTimeout());
            }
            ex.context.awaitChange(seen, shorter(remaining, properties.getGatePollInterval()));
        }
    }

    private void generatePrd(Execution ex, String goal) {
        beginStage(ex, StageId.GENERATE_PRD);
        ex.prd = generator.prd(ex.feature, ex.evidenceMap, goal, ex.context.trace());
        String path = store.writeArtifact(ex.runId, "PRD.md", ex.prd);
        mutate(ex, run -> run.getOutputsIndex().put("prd", path));
        completeStage(ex, StageOutcome.DONE, null);
    }

    private void generateDesign(Execution ex) {
        beginStage(ex, StageId.GENERATE_DESIGN);
        String flow = generator.userFlow(ex.feature, ex.prd, ex.context.trace());
        String wireframes = generator.wireframes(ex.feature, ex.prd, ex.context.trace());
        String flowPath = store.writeArtifact(ex.runId, "user-flow.mmd", flow);
        String wireframesPath = store.writeArtifact(ex.runId, "wireframes.html", wireframes);
        mutate(ex, run -> {
            run.getOutputsIndex().put("user_flow", flowPath);
            run.getOutputsIndex().put("wireframes", wireframesPath);
        });
        completeStage(ex, StageOutcome.DONE, null);
    }

    private void awaitApproval(Execution ex) throws InterruptedException {
        beginStage(ex, StageId.AWAITING_APPROVAL, RunStatus.AWAITING_APPROVAL, run -> {});
        Workspace workspace = ex.workspace;

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("run_id", ex.runId);
        request.put("workspace_id", workspace.workspaceId());
        request.put("feature", ex.feature.feature());
        request.put("approvers", workspace.approvers());
        request.put("requested_at", Instant.now());
        String path = store.writeJsonArtifact(ex.runId, "approval-request.json", request);
        mutate(ex, run -> run.getOutputsIndex().put("approval_request", path));

        try {
            approvalNotifier.requestApproval(ex.runId, workspace, ex.feature.feature());
        } catch (RuntimeException e) {
            log.warn("Approval notification for run {} failed: {}", ex.runId, e.getMessage());
        }

        Instant deadline = Instant.now().plus(properties.getApprovalTimeout());
        while (true) {
            long seen = ex.context.version();
            Run run = store.load(ex.runId);
            requireNotCancelled(run);
            if (approvalSettled(run.getApprovalState(), workspace.approvers())) {
                break;
            }
            Duration remaining = Duration.between(Instant.now(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                throw new PipelineException(FailureCause.APPROVAL_TIMEOUT,
                        "Timed out waiting for approval after " + properties.getApprovalTimeout());
            }
            ex.context.awaitChange(seen, shorter(remaining, properties.getGatePollInterval()));
        }
        log.info("Run {} approved", ex.runId);
        completeStage(ex, StageOutcome.DONE, null);
    }

    /**
     * @return true once the gate may pass
     * @throws PipelineException on any CHANGES_REQUESTED
     */
    static boolean approvalSettled(Map<String, ApprovalDecision> decisions, List<String> approvers) {
        for (Map.Entry<String, ApprovalDecision> e : decisions.entrySet()) {
            if (e.getValue() == ApprovalDecision.CHANGES_REQUESTED) {
                throw new PipelineException(FailureCause.APPROVAL_REJECTED, "Changes requested by " + e.getKey());
            }
        }
        if (approvers.isEmpty()) {
            return !decisions.isEmpty();
        }
        return approvers.stream().allMatch(a -> decisions.get(a) == ApprovalDecision.APPROVED);
    }

    private void generateTickets(Execution ex) {
        beginStage(ex, StageId.GENERATE_TICKETS);
        JsonNode raw = generator.tickets(ex.feature, ex.prd, ex.context.trace());
        ex.plan = schemaValidator.ticketPlan(raw);
        String path = store.writeJsonArtifact(ex.runId, "tickets.json", ex.plan);
        mutate(ex, run -> run.getOutputsIndex().put("tickets", path));
        log.info("Planned {} tickets ({} h)", ex.plan.tickets().size(), ex.plan.totalEstimateHours());
        completeStage(ex, StageOutcome.DONE, null);
    }

    private void implement(Execution ex) {
        beginStage(ex, StageId.IMPLEMENT);
        ex.lease = repository.acquire(ex.workspace.workspaceId());
        ex.tree = repository.prepare(ex.workspace);
        String repoContext = repository.readContext(ex.tree, ex.plan.expectedFiles());

        String patch = generator.codePatch(ex.plan, repoContext, ex.context.trace());
        String path = store.writeArtifact(ex.runId, "diff.patch", patch);
        mutate(ex, run -> run.getOutputsIndex().put("diff", path));
        PatchResult result = applyPatch(ex, patch);
        if (!result.applied()) {
            log.warn("Patch rejected ({}), regenerating once: {}", result.failure(), result.error());
            patch = generator.regeneratePatch(ex.plan, repoContext, patch, result.error(), ex.context.trace());
            store.writeArtifact(ex.runId, "diff.patch", patch);
            result = applyPatch(ex, patch);
            if (!result.applied()) {
                throw new PipelineException(FailureCause.PATCH_APPLY,
                        "Patch could not be applied (%s): %s".formatted(result.failure(), result.error()));
            }
        }
        ex.filesChanged.addAll(result.filesModified());

        if (ex.workspace.guardrails().mode() == WorkspaceMode.PR) {
            String note = """
                    # PR Mode

                    Branch: %s
                    Files changed: %s

                    The applied diff is in diff.patch and is ready to be submitted as a pull request.
                    """.formatted(ex.workspace.branch(), String.join(", ", ex.filesChanged));
            String notePath = store.writeArtifact(ex.runId, "pr-mode.md", note);
            mutate(ex, run -> run.getOutputsIndex().put("pr_note", notePath));
        }
        completeStage(ex, StageOutcome.DONE, null);
    }

    private VerificationResult verifyAndHeal(Execution ex) {
        VerificationResult result = verify(ex);
        int maxRetries = ex.workspace.guardrails().effectiveMaxRetries();
        int retries = 0;
        while (!result.passed() && retries < maxRetries) {
            int attempt = ++retries;
            beginStage(ex, StageId.SELF_HEAL, RunStatus.RETRYING, run -> run.setRetryCount(attempt));
            metrics.recordSelfHealAttempt();
            log.info("Self-heal attempt {}/{} after {}", attempt, maxRetries, result.summary());

            Set<String> contextFiles = new LinkedHashSet<>(ex.plan.expectedFiles());
            contextFiles.addAll(ex.filesChanged);
            String repoContext = repository.readContext(ex.tree, List.copyOf(contextFiles));
            String fix = generator.fixPatch(attempt, result, repoContext, ex.context.trace());
            String name = "fix-" + attempt + ".patch";
            String path = store.writeArtifact(ex.runId, name, fix);
            mutate(ex, run -> run.getOutputsIndex().put("fix_" + attempt, path));

            PatchResult applied = applyPatch(ex, fix);
            if (!applied.applied()) {
                throw new PipelineException(FailureCause.PATCH_APPLY,
                        "Corrective patch %d could not be applied (%s): %s"
                                .formatted(attempt, applied.failure(), applied.error()));
            }
            ex.filesChanged.addAll(applied.filesModified());
            completeStage(ex, StageOutcome.DONE, null);
            result = verify(ex);
        }
        return result;
    }

    private VerificationResult verify(Execution ex) {
        beginStage(ex, StageId.VERIFY);
        String command = verificationProperties.getDefaultCommand();
        VerificationResult result = verificationRunner.run(ex.tree, command, verificationProperties.getTimeout());
        ex.lastVerification = result;
        String path = store.writeArtifact(ex.runId, RunReports.TEST_REPORT, RunReports.testReport(command, result));
        mutate(ex, run -> run.getOutputsIndex().put("test_report", path));
        metrics.recordVerification(result.summary(), result.durationMs());
        emit(ex, RunEvent.of(StageId.VERIFY, "verification", result.summary(), result.durationMs(), null));
        if (result.passed()) {
            completeStage(ex, StageOutcome.DONE, null);
        } else {
            log.info("Verification {} with exit code {}", result.summary(), result.exitCode());
            completeStage(ex, StageOutcome.FAILED, VERIFICATION_FAILED);
        }
        return result;
    }

    private void export(Execution ex, VerificationResult result) {
        beginStage(ex, StageId.EXPORT);
        boolean passed = result.passed();
        if (!passed) {
            Run run = store.load(ex.runId);
            writeFailureReport(ex, StageId.VERIFY, FailureCause.VERIFICATION, VERIFICATION_FAILED, run.getRetryCount());
        }
        writeExportArtifacts(ex);
        completeStage(ex, StageOutcome.DONE, null);

        RunStatus finalStatus = passed ? RunStatus.COMPLETED : RunStatus.FAILED;
        Run finished = mutate(ex, run -> {
            run.transitionTo(finalStatus);
            if (!passed) {
                run.setFailureCause(FailureCause.VERIFICATION);
                run.setLastError(VERIFICATION_FAILED);
            }
            run.getTimestamps().put(Run.COMPLETED_AT, Instant.now());
        });
        emit(ex, RunEvent.of(null, passed ? RUN_COMPLETED : RUN_FAILED, finalStatus.name().toLowerCase(Locale.ROOT),
                null, passed ? null : VERIFICATION_FAILED));
        metrics.recordRunResult(finalStatus.name());
        metrics.recordRetriesUsed(finished.getRetryCount());
        log.info("Run {} {} after {} retries", ex.runId, finalStatus, finished.getRetryCount());
    }

    // --- failure handling ---

    private void fail(Execution ex, PipelineException failure) {
        Run current = safeLoad(ex.runId);
        boolean cancelled = failure.getFailureCause() == FailureCause.CANCELLED
                || (current != null && current.getStatus() == RunStatus.CANCELLED);
        FailureCause cause = cancelled ? FailureCause.CANCELLED : failure.getFailureCause();
        String error = cancelled ? CANCELLED_ERROR : failure.getMessage();
        if (cancelled) {
            log.info("Run {} cancelled during {}", ex.runId, ex.stage);
        } else {
            log.error("Run {} failed in {}: {}", ex.runId, ex.stage, failure.toString(), failure);
        }
        if (current == null) {
            return;
        }
        if (current.getStatus() == RunStatus.COMPLETED) {
            log.warn("Run {} already completed, keeping its result", ex.runId);
            return;
        }

        try {
            if (ex.stageOpen) {
                recordStageEnd(ex, StageOutcome.FAILED, error);
            }
            if (!cancelled) {
                writeFailureReport(ex, ex.stage, cause, error, current.getRetryCount());
            }
            writeExportArtifacts(ex);
        } catch (RuntimeException e) {
            log.warn("Best-effort export for run {} failed: {}", ex.runId, e.getMessage());
        }

        try {
            Run finished = store.update(ex.runId, run -> {
                if (run.getStatus() == RunStatus.COMPLETED) {
                    return;
                }
                if (!run.isTerminal()) {
                    run.transitionTo(RunStatus.FAILED);
                }
                run.setFailureCause(cause);
                run.setLastError(error);
                if (run.getTimestamps().get(Run.COMPLETED_AT) == null) {
                    run.getTimestamps().put(Run.COMPLETED_AT, Instant.now());
                }
            });
            if (finished.getStatus() == RunStatus.COMPLETED) {
                return;
            }
            emit(ex, RunEvent.of(ex.stage, finished.getStatus() == RunStatus.CANCELLED ? RUN_CANCELLED : RUN_FAILED,
                    finished.getStatus().name().toLowerCase(Locale.ROOT), null, error));
            metrics.recordRunResult(finished.getStatus().name());
            metrics.recordRetriesUsed(finished.getRetryCount());
        } catch (RuntimeException e) {
            log.error("Could not record failure of run {}: {}", ex.runId, e.getMessage(), e);
        }
    }

    static FailureCause classify(RuntimeException e) {
        if (e instanceof SchemaValidationException || e instanceof GenerationParseException) {
            return FailureCause.VALIDATION;
        }
        if (e instanceof GenerationUnavailableException) {
            return FailureCause.GENERATION_UNAVAILABLE;
        }
        return FailureCause.INFRASTRUCTURE;
    }

    private void writeFailureReport(Execution ex, StageId stage, FailureCause cause, String error, int retries) {
        String path = store.writeArtifact(ex.runId, RunReports.FAILURE_REPORT,
                RunReports.failureReport(stage, cause, error, retries));
        store.update(ex.runId, run -> run.getOutputsIndex().put("failure_report", path));
    }

    /**
     * Scorecard, generation trace, manifest and archive. Also used best-effort after a failure,
     * so it never checks for cancellation.
     */
    private void writeExportArtifacts(Execution ex) {
        Run run = store.load(ex.runId);
        ExportSummary summary = ExportSummary.of(run, ex.lastVerification, ex.plan, ex.evidenceMap,
                ex.filesChanged, Instant.now());
        String summaryPath = store.writeJsonArtifact(ex.runId, "run-summary.json", summary);
        String tracePath = store.writeJsonArtifact(ex.runId, "generation-trace.json", ex.context.trace().calls());
        Run withOutputs = store.update(ex.runId, r -> {
            r.getOutputsIndex().put("run_summary", summaryPath);
            r.getOutputsIndex().put("generation_trace", tracePath);
        });
        packager.pack(store.artifactsDir(ex.runId), withOutputs.getStageHistory(), withOutputs.getTimestamps());
        store.update(ex.runId, r -> {
            r.getOutputsIndex().put("manifest", RunStore.ARTIFACTS_DIR + "/" + ArtifactStages.MANIFEST);
            r.getOutputsIndex().put("archive", RunStore.ARTIFACTS_DIR + "/" + ArtifactStages.ARCHIVE);
        });
    }

    // --- stage bookkeeping ---

    private void beginStage(Execution ex, StageId stage) {
        beginStage(ex, stage, RunStatus.RUNNING, run -> {});
    }

    private void beginStage(Execution ex, StageId stage, RunStatus status, Consumer<Run> extra) {
        MdcContext.setStage(stage);
        mutate(ex, run -> {
            run.transitionTo(status);
            run.setCurrentStage(stage);
            extra.accept(run);
        });
        ex.stage = stage;
        ex.stageStartedAt = Instant.now();
        ex.stageOpen = true;
        emit(ex, RunEvent.stageStart(stage));
        log.debug("Stage {} started", stage);
    }

    private void completeStage(Execution ex, StageOutcome outcome, String error) {
        Run current = store.load(ex.runId);
        requireNotCancelled(current);
        recordStageEnd(ex, outcome, error);
    }

    private void recordStageEnd(Execution ex, StageOutcome outcome, String error) {
        Instant now = Instant.now();
        long latency = Duration.between(ex.stageStartedAt, now).toMillis();
        StageId stage = ex.stage;
        Instant startedAt = ex.stageStartedAt;
        store.update(ex.runId, run -> run.addStageRecord(new StageRecord(stage, outcome, startedAt, now, error)));
        ex.stageOpen = false;
        emit(ex, RunEvent.stageEnd(stage, outcome.name().toLowerCase(Locale.ROOT), latency, error));
        metrics.recordStageDuration(stage.name(), latency);
    }

    private PatchResult applyPatch(Execution ex, String diff) {
        PatchResult result = patchApplier.apply(diff, ex.tree, ex.workspace.guardrails().forbiddenPaths());
        String outcome = result.applied() ? "applied" : result.failure().name().toLowerCase(Locale.ROOT);
        metrics.recordPatchApplication(result.applied() ? result.strategy() : "none", outcome);
        emit(ex, RunEvent.of(ex.stage, "patch_apply", outcome, null, result.error()));
        return result;
    }

    /**
     * Locked reload-mutate-save that refuses to touch a cancelled run.
     */
    private Run mutate(Execution ex, Consumer<Run> mutation) {
        return store.update(ex.runId, run -> {
            requireNotCancelled(run);
            mutation.accept(run);
        });
    }

    private void emit(Execution ex, RunEvent event) {
        store.appendEvent(ex.runId, event);
        eventBus.publish(ex.runId, event);
    }

    private static void requireNotCancelled(Run run) {
        if (run.getStatus() == RunStatus.CANCELLED) {
            throw new PipelineException(FailureCause.CANCELLED, CANCELLED_ERROR);
        }
    }

    private Run safeLoad(String runId) {
        try {
            return store.load(runId);
        } catch (RuntimeException e) {
            log.error("Run {} state unreadable while failing: {}", runId, e.getMessage());
            return null;
        }
    }

    private static int clamp(int index, int size) {
        return Math.max(0, Math.min(index, size - 1));
    }

    private static Duration shorter(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    /** Worker-local state carried between stages. */
    private static final class Execution {
        final String runId;
        final RunContext context;
        final Set<String> filesChanged = new LinkedHashSet<>();
        Workspace workspace;
        Path evidenceDir;
        List<String> evidenceFiles = List.of();
        EvidenceMap evidenceMap;
        FeatureCandidate feature;
        String prd;
        TicketPlan plan;
        Path tree;
        TargetRepository.Lease lease;
        VerificationResult lastVerification;
        StageId stage;
        Instant stageStartedAt;
        boolean stageOpen;

        Execution(String runId, RunContext context) {
            this.runId = runId;
            this.context = context;
        }
    }
}
