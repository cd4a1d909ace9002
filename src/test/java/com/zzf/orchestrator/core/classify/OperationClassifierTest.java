package com.zzf.orchestrator.core.classify;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OperationClassifierTest {

    private final OperationClassifier classifier = new OperationClassifier();

    @Test
    void shouldClassifyRememberStatementAsWrite() {
        assertEquals(OperationType.WRITE, classifier.classify("Remember that my name is Matt"));
        assertEquals(OperationType.WRITE, classifier.classify("I prefer dark roast coffee"));
        assertEquals(OperationType.WRITE, classifier.classify("Please write down the meeting is on Friday"));
    }

    @Test
    void shouldClassifyQuestionsAboutTheUserAsRead() {
        assertEquals(OperationType.READ, classifier.classify("What is my name?"));
        assertEquals(OperationType.READ, classifier.classify("Can you remind me of my project?"));
        assertEquals(OperationType.READ, classifier.classify("search for notes about the trip"));
    }

    @Test
    void shouldPreferReadWhenBothFamiliesMatch() {
        assertEquals(OperationType.READ, classifier.classify("Do you remember my favourite colour?"));
    }

    @Test
    void shouldFallBackToGeneral() {
        assertEquals(OperationType.GENERAL, classifier.classify("Hello there"));
        assertEquals(OperationType.GENERAL, classifier.classify("Explain how tides work"));
        assertEquals(OperationType.GENERAL, classifier.classify(""));
        assertEquals(OperationType.GENERAL, classifier.classify(null));
    }

    @Test
    void shouldBeCaseInsensitive() {
        assertEquals(OperationType.WRITE, classifier.classify("REMEMBER THIS: the wifi code changed"));
    }
}
