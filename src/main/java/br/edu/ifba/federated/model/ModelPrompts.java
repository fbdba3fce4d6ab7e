package br.edu.ifba.federated.model;

/**
 * Prompt templates used by the model provider and the retrieval synthesis step.
 */
public final class ModelPrompts {

    public static final String DEFAULT_SYSTEM = "You are a helpful assistant.";

    static final String REFINE_SYSTEM = "You are a semantic query expander. Return ONLY the broad question.";

    private static final String REFINE_TEMPLATE = """
        The user provided a short, ambiguous search term for a RAG system. \
        Expand this term into a broad question that asks for 'definitions, categories, or examples' \
        of the term within the document. Avoid assuming a specific industry or domain. \
        Term: '{query}'""";

    static final String ENTITY_SYSTEM = """
        You are a precise entity and concept extractor. Return ONLY a JSON array of names \
        (e.g. ["Requirements Analysis", "Security"]). Do not explain.""";

    private static final String ENTITY_TEMPLATE = """
        Analyze the following query and extract up to {max} of the most relevant primary entities \
        (Person, Organization, Project, Location) OR Key Concepts (Technical Term, Process). \
        If there are none, return 'None'. Query: '{query}'""";

    static final String GRAPH_EXTRACTION_SYSTEM = """
        You are a Knowledge Graph Engineer. Output a VALID JSON object containing a list of entities and a list of relationships.
        Rules:
        1. **Entities**: Extract People, Organizations, Locations, Projects, Key Concepts, Technical Terms, Processes, Methodologies etc.
        2. **Relationships**: Use specific verbs (e.g., "MANAGED_BY", "LOCATED_IN", "RELATES_TO", "PART_OF").
        Output Format:
        {
          "entities": [{"name": "Entity Name", "type": "PERSON/ORG/CONCEPT"}],
          "relationships": [{"source": "Entity Name", "target": "Entity Name", "relation": "RELATION_TYPE"}]
        }
        """;

    private static final String GRAPH_EXTRACTION_TEMPLATE = """
        Analyze the following text and extract the knowledge graph:
        {text}
        """;

    private static final String SUMMARY_TEMPLATE = """
        You are an expert technical writer.
        Your task is to provide a comprehensive summary of the document provided below.
        Requirements:
        1. Identify the main Subject, Key Entities (People, Companies), and Dates.
        2. Summarize the core purpose of the document.
        3. Keep it dense and factual (approx. 200 words).

        Document Text:
        {text}
        """;

    private static final String SUMMARY_MERGE_TEMPLATE = """
        Merge these two summaries into one dense, factual summary:
        1. %s
        2. %s
        """;

    private static final String CONTEXTUAL_HEADER_TEMPLATE = """
        <document_context>
        %s
        </document_context>
        <chunk_content>
        %s
        </chunk_content>
        Task: Write a brief **"Contextual Header"** (1-2 sentences) that explains what this specific chunk is about *in the context of the whole document*.
        Your Header:
        """;

    public static final String NOT_FOUND_ANSWER = "I cannot find the answer in the provided documents.";

    private static final String SYNTHESIS_TEMPLATE = """
        You are a helpful assistant.
        Answer the user's query mostly based on the provided Context.

        - If the Context mentions the term, summarize its usage, examples, or categories found.
        - If the answer is NOT in the Context, say "%s"
        - Cite the source filename if possible.

        Original Query: %s
        Refined Intent: %s

        [Graph Relationships]
        %s

        [Relevant Knowledge (%s)]
        %s

        Your Answer:
        """;

    private ModelPrompts() {
    }

    public static String refine(final String query) {
        return REFINE_TEMPLATE.replace("{query}", query);
    }

    public static String entityExtraction(final String query, final int maxEntities) {
        return ENTITY_TEMPLATE
            .replace("{max}", String.valueOf(maxEntities))
            .replace("{query}", query);
    }

    public static String graphExtraction(final String text) {
        return GRAPH_EXTRACTION_TEMPLATE.replace("{text}", text);
    }

    public static String summary(final String text) {
        return SUMMARY_TEMPLATE.replace("{text}", text);
    }

    public static String summaryMerge(final String first, final String second) {
        return SUMMARY_MERGE_TEMPLATE.formatted(first, second);
    }

    public static String contextualHeader(final String summary, final String chunk) {
        return CONTEXTUAL_HEADER_TEMPLATE.formatted(summary, chunk);
    }

    public static String synthesis(
            final String query,
            final String refinedQuery,
            final String graphSection,
            final String mode,
            final String context) {
        return SYNTHESIS_TEMPLATE.formatted(NOT_FOUND_ANSWER, query, refinedQuery, graphSection, mode, context);
    }
}
