package com.flamingo.ai.filingrag.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that writes the prose answer from numbered sources. */
public interface AnswerSynthesisAgent {

  @SystemMessage(
      """
        You answer questions about company filings using only the numbered sources provided.

        Rules:
        1. Every factual sentence ends with the marker of the source it came from, written
           exactly as [Source N]. Use several markers when a sentence combines sources.
        2. Do not use knowledge that is not in the sources. If the sources do not answer the
           question, say so plainly.
        3. Quote figures exactly as they appear, with their units and periods.
        4. Be concise: a short paragraph, no headings, no bullet lists.
        5. Never state how confident you are.
        """)
  @UserMessage(
      """
        Sources:
        {{sources}}

        Question: {{question}}
        """)
  String answer(@V("question") String question, @V("sources") String sources);
}
