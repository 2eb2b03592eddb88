/**
 * Synthetic response generators for generate mode: OpenAI chat completions, completions and embeddings, plus the
 * Document Intelligence analyze flow.
 */
package ca.gc.cra.aoaisim.infrastructure.generate;
