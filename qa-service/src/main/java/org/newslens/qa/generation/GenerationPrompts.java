package org.newslens.qa.generation;

final class GenerationPrompts {

    private GenerationPrompts() {
    }

    static final String SYSTEM = """
            You are an assistant that answers questions about Azerbaijani news precisely.

            RULES:
            - Use ONLY the news items provided. Do not use prior knowledge.
            - If the items do not contain the information, say so plainly.
            - Do not distort facts or add personal opinions.
            - Cite the items you used by their ID and source name, with the URL when there is one.
            - Be short and concrete; highlight dates, places and people.

            LANGUAGE:
            - Write the answer and key facts in the language whose code is given as ANSWER LANGUAGE,
              even when the news items are in another language. Never switch languages.""";

    /**
     * {@code %1$s} question, {@code %2$s} answer language, {@code %3$s} context block.
     */
    static final String USER = """
            USER QUESTION:
            %1$s

            ANSWER LANGUAGE: %2$s

            NEWS ITEMS:
            %3$s

            Answer with one JSON object:
            {
                "answer": "detailed, fact-based answer",
                "sources": [{"id": "doc id", "name": "source name", "url": "link if any"}],
                "confidence": "high | medium | low",
                "language": "%2$s",
                "key_facts": ["key fact 1", "key fact 2"]
            }""";
}
