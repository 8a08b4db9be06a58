package com.flamingo.ai.kbanalytics.agent;

import com.flamingo.ai.kbanalytics.agent.dto.DocumentUnderstandingResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that reads a knowledge-base document and extracts the metadata the analytics engine
 * builds on: a short summary, topics, technologies and insights.
 *
 * <p>Topics and technologies become Topic/Technology nodes in the knowledge graph and drive the
 * team expertise map, so they must be short labels rather than sentences.
 */
public interface DocumentUnderstandingAgent {

  @SystemMessage(
      """
        You are a technical knowledge-base analyst. Analyze the provided document and return a
        JSON object with four fields:

        1. "summary": A 2-4 sentence summary of what the document covers. Do not start with
           "This document" or "The document".

        2. "topics": An array of 3-8 short topic labels (1-3 words each), such as
           "database migration" or "incident response". Use lowercase.

        3. "technologies": An array of concrete technologies, languages, frameworks or tools
           mentioned in the document, such as "postgresql" or "kubernetes". Use lowercase.
           Return an empty array when none are mentioned.

        4. "insights": An array of 0-5 key takeaways, each a single sentence.

        Return ONLY valid JSON matching this structure:
        {"summary": "...", "topics": ["..."], "technologies": ["..."], "insights": ["..."]}
        """)
  @UserMessage("""
        Title: {{title}}

        Content:
        {{content}}
        """)
  DocumentUnderstandingResult analyze(@V("title") String title, @V("content") String content);
}
