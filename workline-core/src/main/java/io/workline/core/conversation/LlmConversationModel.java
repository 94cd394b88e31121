package io.workline.core.conversation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.workline.core.provider.ChatMessage;
import io.workline.core.provider.LlmProvider;
import io.workline.core.provider.LlmResponse;
import io.workline.core.session.TranscriptEntry;
import io.workline.core.timeline.EmploymentGap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Conversation model backed by a chat-completions provider that must answer with one JSON object:
 * {@code assistant_reply}, {@code extracted_data} and {@code conversation_analysis}.
 */
public final class LlmConversationModel implements ConversationModel {
    private static final String PERSONA = """
        You are a warm, patient phone interviewer collecting a caller's employment history.
        Ask one short question at a time, in plain spoken language, one or two sentences.
        Build the work timeline year by year and ask about missing years gently.
        Only record facts the caller actually stated. Tell paid work apart from personal or family activity.
        When the work history, education and skills are all gathered, end with:
        "Thank you! I have all the information I need."
        """;
    private static final String RESPONSE_FORMAT = """
        RESPOND WITH VALID JSON ONLY, using exactly this structure:
        {
          "assistant_reply": "your 1-2 sentence spoken reply",
          "extracted_data": {
            "full_name": null, "employer_name": null, "job_title": null,
            "start_date": "YYYY or null", "end_date": "YYYY or null",
            "school_name": null, "degree": null, "skills": []
          },
          "conversation_analysis": {
            "is_work_experience": true,
            "missing_fields": [],
            "next_question_focus": "what to ask next",
            "is_complete": false
          }
        }
        """;

    private final LlmProvider provider;
    private final String model;
    private final ObjectMapper mapper;

    public LlmConversationModel(LlmProvider provider, String model) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public ModelReply respond(ConversationContext context) throws MalformedReplyException {
        LlmResponse response = provider.chat(model, messages(context));
        if (response.failed()) {
            throw new MalformedReplyException(response.content());
        }
        return parse(response.content());
    }

    List<ChatMessage> messages(ConversationContext context) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(PERSONA + "\n" + situation(context)));
        for (TranscriptEntry entry : context.recentTurns()) {
            messages.add(entry.speaker() == TranscriptEntry.Speaker.AGENT
                ? ChatMessage.assistant(entry.text())
                : ChatMessage.user(entry.text()));
        }
        messages.add(ChatMessage.user(context.utterance()));
        messages.add(ChatMessage.system(RESPONSE_FORMAT));
        return messages;
    }

    private String situation(ConversationContext context) {
        StringBuilder text = new StringBuilder();
        text.append("Current stage: ").append(context.stage().name().toLowerCase(Locale.ROOT)).append('\n');
        text.append("Profile completeness: ").append(Math.round(context.completeness() * 100)).append("%\n");
        if (!context.missingFields().isEmpty()) {
            text.append("Still missing: ").append(String.join(", ", context.missingFields())).append('\n');
        }
        for (EmploymentGap gap : context.priorityGaps()) {
            text.append("Unexplained gap ").append(gap.startYear()).append('-').append(gap.endYear())
                .append(" (").append(gap.severity().name().toLowerCase(Locale.ROOT)).append(")");
            if (!gap.followUpQuestions().isEmpty()) {
                text.append(", you could ask: ").append(gap.followUpQuestions().get(0));
            }
            text.append('\n');
        }
        if (context.strategy() != null) {
            for (String tip : context.strategy().tips()) {
                text.append("Tip: ").append(tip).append('\n');
            }
        }
        if (context.posture() != AdversarialLevel.LOW) {
            text.append("The caller sounds reluctant. Acknowledge that, explain why you are asking, and offer simple choices.\n");
        }
        return text.toString();
    }

    ModelReply parse(String raw) throws MalformedReplyException {
        String text = stripFences(raw);
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MalformedReplyException("Model reply is not JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedReplyException("Model reply is not a JSON object");
        }
        JsonNode reply = root.path("assistant_reply");
        if (!reply.isTextual() || reply.asText().isBlank()) {
            throw new MalformedReplyException("Model reply has no assistant_reply");
        }

        Map<String, List<String>> fields = new LinkedHashMap<>();
        JsonNode extracted = root.path("extracted_data");
        if (extracted.isObject()) {
            extracted.fields().forEachRemaining(field -> {
                List<String> values = values(field.getValue());
                if (!values.isEmpty()) {
                    fields.put(field.getKey(), values);
                }
            });
        }

        JsonNode analysis = root.path("conversation_analysis");
        ModelReply.Analysis parsed = new ModelReply.Analysis(
            analysis.path("is_work_experience").asBoolean(true),
            values(analysis.path("missing_fields")),
            analysis.path("next_question_focus").asText(""),
            analysis.path("is_complete").asBoolean(false)
        );
        return new ModelReply(reply.asText(), fields, parsed);
    }

    private List<String> values(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                addValue(values, item);
            }
        } else {
            addValue(values, node);
        }
        return values;
    }

    private void addValue(List<String> values, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
            return;
        }
        String value = node.asText("").trim();
        if (!value.isEmpty() && !"null".equalsIgnoreCase(value) && !values.contains(value)) {
            values.add(value);
        }
    }

    private String stripFences(String raw) {
        String text = raw == null ? "" : raw.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline < 0 ? "" : text.substring(firstNewline + 1);
            int closing = text.lastIndexOf("```");
            if (closing >= 0) {
                text = text.substring(0, closing);
            }
        }
        return text.trim();
    }
}
