package io.workline.core.conversation;

import io.workline.core.session.CallSession;
import io.workline.core.session.ConversationState;
import io.workline.core.session.FieldValue;
import io.workline.core.session.SessionPatch;
import io.workline.core.session.TranscriptEntry;
import io.workline.core.timeline.EmploymentFragment;
import io.workline.core.timeline.EmploymentGap;
import io.workline.core.timeline.TimelineAnalysis;
import io.workline.core.timeline.TimelineAnalyzer;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one caller turn against a session snapshot and returns the next snapshot. Never persists
 * anything itself.
 */
public final class ConversationEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ConversationEngine.class);

    public static final String FALLBACK_PROMPT = "I'm sorry, could you repeat that?";
    public static final String CLOSING_PROMPT = "I understand. Thank you for your time today. Goodbye.";
    public static final String REASON_COMPLETE = "interview_complete";
    public static final String REASON_CALLER_ENDED = "caller_requested_end";
    public static final String REASON_MAX_TURNS = "max_turns_reached";
    public static final String REASON_ADVERSARIAL = "adversarial_ceiling";

    private static final double HEURISTIC_CONFIDENCE = 0.6;
    private static final double MODEL_CONFIDENCE = 0.9;
    private static final int PRIORITY_GAPS_IN_CONTEXT = 3;
    private static final Pattern YEAR_PATTERN = Pattern.compile("\\b(?:19|20)\\d{2}\\b");
    private static final List<String> COMPLETION_PHRASES = List.of(
        "thank you! i have all the information",
        "i have all the information i need",
        "that completes our interview",
        "we have everything we need"
    );

    private final ConversationModel model;
    private final UtteranceClassifier classifier;
    private final TimelineAnalyzer analyzer;
    private final ConversationSettings settings;
    private final FieldCatalog catalog;
    private final StageResolver stages;
    private final Clock clock;

    public ConversationEngine(
        ConversationModel model,
        UtteranceClassifier classifier,
        TimelineAnalyzer analyzer,
        ConversationSettings settings,
        Clock clock
    ) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.catalog = FieldCatalog.from(settings);
        this.stages = new StageResolver(catalog);
    }

    public TurnResult turn(CallSession session, String utterance) {
        Objects.requireNonNull(session, "session must not be null");
        String said = utterance == null ? "" : utterance.trim();
        Instant now = clock.instant();
        ConversationState state = session.conversationState();

        Classification classification = classifier.classify(said, state.callerUtterances());
        double adversarialScore = session.adversarialScore() + classification.score();

        ConversationContext context = context(session, state, said, adversarialScore);
        ModelReply reply;
        boolean fallback = false;
        try {
            reply = model.respond(context);
        } catch (MalformedReplyException e) {
            LOG.warn("Model reply unusable for call {} on turn {}: {}", session.callId(), state.turnCount() + 1, e.getMessage());
            reply = null;
            fallback = true;
        } catch (RuntimeException e) {
            LOG.error("Model call crashed for call {} on turn {}", session.callId(), state.turnCount() + 1, e);
            reply = null;
            fallback = true;
        }

        Map<String, List<FieldValue>> fields = session.extractedFields();
        List<EmploymentFragment> fragments = state.fragments();
        if (!fallback) {
            fields = mergeFields(fields, heuristicFields(classification, reply), HEURISTIC_CONFIDENCE, now);
            fields = mergeFields(fields, reply.extractedFields(), MODEL_CONFIDENCE, now);
            EmploymentFragment fragment = fragment(classification, reply, said);
            if (fragment != null) {
                fragments = attach(fragments, fragment);
            }
        }

        TimelineAnalysis timeline = analyzer.analyze(fragments);
        int turnCount = state.turnCount() + 1;
        double completeness = catalog.completeness(fields);
        List<String> missing = catalog.missing(fields);
        ConversationStage stage = stages.resolve(turnCount, fields, timeline);

        // a fallback turn cannot complete the interview, but the caller and the limits can still end it
        String terminationReason = terminationReason(classification, reply, completeness, turnCount, adversarialScore);
        boolean finished = !terminationReason.isEmpty();
        boolean complete = REASON_COMPLETE.equals(terminationReason);
        String message;
        if (finished && !complete) {
            message = CLOSING_PROMPT;
        } else if (fallback) {
            message = FALLBACK_PROMPT;
        } else {
            message = reply.reply();
        }
        if (finished) {
            stage = ConversationStage.CLOSING;
        }

        List<TranscriptEntry> transcript = new ArrayList<>(state.transcript());
        transcript.add(new TranscriptEntry(TranscriptEntry.Speaker.CALLER, said, now));
        transcript.add(new TranscriptEntry(TranscriptEntry.Speaker.AGENT, message, now));

        ConversationState next = new ConversationState(
            stage,
            turnCount,
            transcript,
            fragments,
            missing,
            fallback ? "clarification" : reply.analysis().nextQuestionFocus(),
            completeness,
            complete,
            complete ? "" : terminationReason
        );
        CallSession updated = session.apply(SessionPatch.empty()
            .withConversationState(next)
            .withExtractedFields(fields)
            .withTimeline(timeline.periods(), timeline.gaps())
            .withAdversarialScore(adversarialScore));

        if (finished) {
            LOG.info("Call {} finishing after {} turns: {}", session.callId(), turnCount, terminationReason);
        }
        return new TurnResult(message, finished ? NextAction.COMPLETE : NextAction.CONTINUE, updated, fallback);
    }

    /**
     * The posture follows the mean score per caller turn so far, this turn included.
     */
    private ConversationContext context(CallSession session, ConversationState state, String said, double adversarialScore) {
        TimelineAnalysis current = analyzer.analyze(state.fragments());
        List<EmploymentGap> priority = analyzer.prioritize(current.openGaps());
        List<TranscriptEntry> transcript = state.transcript();
        List<TranscriptEntry> recent = transcript.subList(Math.max(0, transcript.size() - settings.historyWindow()), transcript.size());
        return new ConversationContext(
            stages.resolve(state.turnCount(), session.extractedFields(), current),
            catalog.missing(session.extractedFields()),
            priority.subList(0, Math.min(PRIORITY_GAPS_IN_CONTEXT, priority.size())),
            analyzer.suggestStrategy(current),
            AdversarialLevel.of(adversarialScore / (state.turnCount() + 1)),
            catalog.completeness(session.extractedFields()),
            recent,
            said
        );
    }

    /**
     * {@code reply} is null on a fallback turn.
     */
    private String terminationReason(
        Classification classification,
        ModelReply reply,
        double completeness,
        int turnCount,
        double adversarialScore
    ) {
        if (classification.terminationIntent()) {
            return REASON_CALLER_ENDED;
        }
        if (reply != null
            && (reply.analysis().complete() || signalsCompletion(reply.reply()) || completeness >= settings.completionThreshold())) {
            return REASON_COMPLETE;
        }
        if (adversarialScore >= settings.adversarialCeiling()) {
            return REASON_ADVERSARIAL;
        }
        if (turnCount >= settings.maxTurns()) {
            return REASON_MAX_TURNS;
        }
        return "";
    }

    private boolean signalsCompletion(String reply) {
        String lowered = reply.toLowerCase(Locale.ROOT);
        return COMPLETION_PHRASES.stream().anyMatch(lowered::contains);
    }

    private EmploymentFragment fragment(Classification classification, ModelReply reply, String said) {
        Set<Integer> years = new LinkedHashSet<>(classification.years());
        years.addAll(yearsIn(reply.extractedFields().get(FieldCatalog.START_DATE)));
        years.addAll(yearsIn(reply.extractedFields().get(FieldCatalog.END_DATE)));

        if (!classification.gapReason().isEmpty()) {
            return EmploymentFragment.gapReason(new ArrayList<>(years), classification.gapReason());
        }
        if (!reply.analysis().relevant()) {
            return years.isEmpty() ? null : EmploymentFragment.gapReason(new ArrayList<>(years), said);
        }
        String employer = firstOf(reply.extractedFields(), classification, FieldCatalog.EMPLOYER_NAME);
        String title = firstOf(reply.extractedFields(), classification, FieldCatalog.JOB_TITLE);
        String industry = firstOf(reply.extractedFields(), classification, FieldCatalog.INDUSTRY);
        if (years.isEmpty() && employer == null && title == null) {
            return null;
        }
        return EmploymentFragment.job(new ArrayList<>(years), employer, title, industry);
    }

    /**
     * Pairs a job named in one turn with years given in the next, in either order.
     */
    private List<EmploymentFragment> attach(List<EmploymentFragment> fragments, EmploymentFragment fragment) {
        List<EmploymentFragment> next = new ArrayList<>(fragments);
        if (!next.isEmpty() && !fragment.explainsAbsence()) {
            EmploymentFragment last = next.get(next.size() - 1);
            boolean yearsForNamedJob = !last.explainsAbsence() && !last.hasYears() && fragment.hasYears()
                && fragment.employer() == null && last.employer() != null;
            boolean jobForBareYears = !last.explainsAbsence() && last.hasYears() && last.employer() == null
                && !fragment.hasYears() && fragment.employer() != null;
            if (yearsForNamedJob || jobForBareYears) {
                next.set(next.size() - 1, EmploymentFragment.job(
                    last.hasYears() ? last.years() : fragment.years(),
                    last.employer() != null ? last.employer() : fragment.employer(),
                    last.title() != null ? last.title() : fragment.title(),
                    last.industry() != null ? last.industry() : fragment.industry()
                ));
                return next;
            }
        }
        next.add(fragment);
        return next;
    }

    private static Map<String, List<String>> heuristicFields(Classification classification, ModelReply reply) {
        if (reply.analysis().relevant()) {
            return classification.fields();
        }
        Map<String, List<String>> fields = new LinkedHashMap<>(classification.fields());
        fields.remove(FieldCatalog.START_DATE);
        fields.remove(FieldCatalog.END_DATE);
        return fields;
    }

    private static String firstOf(Map<String, List<String>> modelFields, Classification classification, String name) {
        List<String> fromModel = modelFields.get(name);
        if (fromModel != null && !fromModel.isEmpty()) {
            return fromModel.get(0);
        }
        return classification.first(name);
    }

    private static List<Integer> yearsIn(List<String> values) {
        List<Integer> years = new ArrayList<>();
        if (values == null) {
            return years;
        }
        for (String value : values) {
            Matcher matcher = YEAR_PATTERN.matcher(value);
            while (matcher.find()) {
                years.add(Integer.parseInt(matcher.group()));
            }
        }
        return years;
    }

    static Map<String, List<FieldValue>> mergeFields(
        Map<String, List<FieldValue>> existing,
        Map<String, List<String>> additions,
        double confidence,
        Instant capturedAt
    ) {
        if (additions.isEmpty()) {
            return existing;
        }
        Map<String, List<FieldValue>> merged = new LinkedHashMap<>();
        existing.forEach((name, values) -> merged.put(name, new ArrayList<>(values)));
        additions.forEach((name, values) -> {
            List<FieldValue> target = merged.computeIfAbsent(name, ignored -> new ArrayList<>());
            for (String value : values) {
                String trimmed = value == null ? "" : value.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                boolean seen = target.stream().anyMatch(v -> v.value().equals(trimmed));
                if (!seen) {
                    target.add(new FieldValue(trimmed, confidence, capturedAt));
                }
            }
        });
        return merged;
    }
}
