package io.workline.core.conversation;

import java.util.List;

public interface UtteranceClassifier {
    Classification classify(String utterance, List<String> previousUtterances);
}
