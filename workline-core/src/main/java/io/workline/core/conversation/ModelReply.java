package io.workline.core.conversation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ModelReply(String reply, Map<String, List<String>> extractedFields, Analysis analysis) {

    /**
     * @param relevant false when the caller talked about personal or family activity rather than paid work
     */
    public record Analysis(boolean relevant, List<String> missingFields, String nextQuestionFocus, boolean complete) {
        public Analysis {
            missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
            nextQuestionFocus = nextQuestionFocus == null ? "" : nextQuestionFocus;
        }

        public static Analysis neutral() {
            return new Analysis(true, List.of(), "", false);
        }
    }

    public ModelReply {
        reply = reply == null ? "" : reply.trim();
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (extractedFields != null) {
            extractedFields.forEach((name, values) -> copy.put(name, values == null ? List.of() : List.copyOf(values)));
        }
        extractedFields = Collections.unmodifiableMap(copy);
        analysis = analysis == null ? Analysis.neutral() : analysis;
    }
}
