package com.unitutor.courseware.pipeline;

import com.unitutor.courseware.model.OutputFormat;

public final class PagePrompts {

    private static final String MARKDOWN_PROMPT_TEMPLATE =
        """
            Role: Experienced university lecturer walking a student through a slide deck.
            Task: Analyse this courseware page in detail.
            
            Cover the following:
            1. **Topic overview**: what is the main subject of this page?
            2. **Core concepts**: list and explain the key concepts, definitions and terms on the page.
            3. **Formulas and figures**: explain the meaning of any formulas, charts or diagrams.
            4. **Difficult points**: point out what students are likely to struggle with.
            5. **Takeaways**: summarise the essentials of the page in plain words.
            6. **Link to previous pages**: if an overview of previous pages is given, explain how this page builds on it.
            
            Write clearly, as if explaining to a student. Output Markdown.
            """;

    private static final String STRUCTURED_PROMPT_TEMPLATE =
        """
            Role: Experienced university lecturer walking a student through a slide deck.
            Task: Analyse this courseware page and answer with a single JSON object, no prose around it.
            
            Schema:
            {
              "page_type": one of "TITLE", "CONTENT", "END", "INDEX",
              "summary": one sentence describing the page,
              "key_points": [{"concept": string, "explanation": string, "is_important": boolean}],
              "analogy": a relatable analogy, may be empty,
              "example": a concrete example, may be empty
            }
            
            If an overview of previous pages is given, use it to keep the explanation consistent.
            """;

    private PagePrompts() {
    }

    public static String forPage(int pageNumber, OutputFormat format) {
        String template = format == OutputFormat.STRUCTURED ? STRUCTURED_PROMPT_TEMPLATE : MARKDOWN_PROMPT_TEMPLATE;
        return "[Page " + pageNumber + "]\n\n" + template;
    }
}
