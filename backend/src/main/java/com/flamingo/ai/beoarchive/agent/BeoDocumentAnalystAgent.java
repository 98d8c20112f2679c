package com.flamingo.ai.beoarchive.agent;

import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that decides whether a mail bundle is a signed BEO and extracts its identifying
 * fields.
 *
 * <p>The system message is supplied at build time (see {@link BeoAnalystInstructions}) so the
 * bundle-composition policy can be changed through configuration. The raw JSON reply is returned
 * unparsed; schema checks happen in the caller.
 */
public interface BeoDocumentAnalystAgent {

  @UserMessage(
      """
        Below is the full text extracted from {{documentCount}} PDF document(s) attached to one
        email. Document boundaries are marked with "===== Document i of n =====" lines.

        ---

        {{content}}

        ---

        Based on these documents only, determine whether they satisfy Condition 1 (signed
        Hospitality form + BEO present) and, if so, extract the BEO number, BEO date and
        organization name. Return only the JSON object described in your instructions.
        """)
  String analyze(@V("documentCount") int documentCount, @V("content") String content);
}
