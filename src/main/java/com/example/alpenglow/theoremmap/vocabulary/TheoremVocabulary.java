package com.example.alpenglow.theoremmap.vocabulary;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Terms and boundary markers shared by the whitepaper extractor, the formal extractor and the
 * matcher. Prose and formal text use different surface syntax for the same boundaries.
 */
public final class TheoremVocabulary {

  private TheoremVocabulary() {}

  // ---------------- prose (whitepaper) ----------------

  private static final String SENTENCE_START = "(?<=[.!?:])[ \\t]+[*_]*";
  private static final String STATEMENT_HEAD = "(?:Theorem|Assumption)\\s+\\d+\\**\\s*[(.:]";
  private static final String PROOF_HEAD = "Proof(?:\\s+Sketch|\\s+Outline)?[*_]*\\s*[.:]";

  /**
   * {@code Theorem 3 (Name). body} or {@code Assumption 1: body}. The keyword either opens a line,
   * with markdown decorations in front tolerated, or starts a new sentence inside a paragraph. In
   * the second case the ordinal must be followed by {@code (}, {@code .} or {@code :}, so "Theorem 3
   * shows" stays a reference. The body ends at a blank line, the next statement or proof, a heading,
   * or the end of input.
   */
  public static final Pattern PROSE_STATEMENT = Pattern.compile(
      "(?:^[ \\t>*_#]*|" + SENTENCE_START + "(?=" + STATEMENT_HEAD + "))"
          + "(Theorem|Assumption)\\s+(\\d+)\\**\\s*(?:\\(([^)]+)\\))?\\**\\s*[.:]?\\**\\s*(.+?)"
          + "(?=\\n[ \\t]*\\n|\\n[ \\t>*_]*(?:Proof|Lemma|Theorem|Assumption)\\b|\\n#|\\z"
          + "|" + SENTENCE_START + "(?:" + STATEMENT_HEAD + "|" + PROOF_HEAD + "))",
      Pattern.CASE_INSENSITIVE | Pattern.DOTALL | Pattern.MULTILINE);

  /** Proof paragraph directly after a statement. */
  public static final Pattern PROSE_PROOF = Pattern.compile(
      "\\s*[*_]*Proof\\b(?:\\s+Sketch|\\s+Outline)?[*_]*\\s*[.:]?[*_]*\\s*(.+?)"
          + "(?=\\n[ \\t]*\\n|\\n[ \\t>*_]*(?:Lemma|Theorem|Assumption)\\b|\\n#|\\z"
          + "|" + SENTENCE_START + STATEMENT_HEAD + ")",
      Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  /** Numbered markdown heading, e.g. {@code ## 2.1 Votor}. */
  public static final Pattern SECTION_HEADING = Pattern.compile("^(#{1,4})\\s+(\\d+(?:\\.\\d+)*)\\s+(.+)$");

  /** References to other numbered statements inside a statement body. */
  public static final Pattern PROSE_REFERENCE =
      Pattern.compile("\\b(Theorem|theorem|Lemma|lemma|Assumption|assumption|Definition|definition)\\s+(\\d+)");

  public static final String UNKNOWN_SECTION = "unknown";

  // ---------------- formal (specification modules) ----------------

  public static final String FORMAL_EXTENSION = ".tla";

  public static final String PROOF_START = "PROOF";
  public static final String PROOF_COMPLETE = "QED";

  private static final String FORMAL_BODY_END = "(?=\\b(?:PROOF|LEMMA|THEOREM)\\b|\\n\\s*====|\\z)";

  public static final Pattern FORMAL_THEOREM = Pattern.compile(
      "\\bTHEOREM\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*==\\s*(.+?)" + FORMAL_BODY_END, Pattern.DOTALL);

  public static final Pattern FORMAL_LEMMA = Pattern.compile(
      "\\bLEMMA\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*==\\s*(.+?)" + FORMAL_BODY_END, Pattern.DOTALL);

  /** {@code BY x}, {@code USE x}, {@code Module!x}, {@code INSTANCE x}. */
  public static final Pattern FORMAL_REFERENCE = Pattern.compile(
      "\\b(?:BY|USE|INSTANCE)\\s+([A-Za-z_][A-Za-z0-9_]*)|\\b[A-Za-z_][A-Za-z0-9_]*!([A-Za-z_][A-Za-z0-9_]*)");

  /** Numbered proof step {@code <1>2. text}. */
  public static final Pattern PROOF_STEP = Pattern.compile(
      "<(\\d+)>(\\d+)\\.\\s*(.+?)(?=\\n\\s*<\\d+>|\\n\\s*PROOF\\b|\\n\\s*QED\\b|\\z)", Pattern.DOTALL);

  public static final Pattern BLOCK_COMMENT = Pattern.compile("\\(\\*.*?\\*\\)", Pattern.DOTALL);

  // ---------------- matching ----------------

  public static final Pattern WORD_TOKEN = Pattern.compile("\\b\\w+\\b");

  /** Substring a formal name must carry for the theorem-name fallback match. */
  public static final String THEOREM_NAME_HINT = "theorem";

  /**
   * Domain terms that make a shared word meaningful. Sharing "the" or "all" says nothing; sharing
   * "finalization" does.
   */
  public static final Set<String> IMPORTANCE_KEYWORDS = Set.of(
      "safety", "safe", "liveness", "progress", "termination",
      "consensus", "agreement", "consistency",
      "finalization", "finalized", "finality", "final",
      "byzantine", "fault", "faults", "adversary", "honest", "malicious", "crash",
      "validator", "validators", "stake", "leader", "leaders",
      "block", "blocks", "slot", "slots", "window", "chain",
      "certificate", "certificates", "notarization", "notarized", "skip",
      "vote", "votes", "voting", "votor", "rotor", "relay", "dissemination",
      "timeout", "timeouts", "network", "partition", "synchrony", "protocol");
}
