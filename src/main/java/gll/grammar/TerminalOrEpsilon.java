package gll.grammar;

/**
 * Symbols that label the leaves of a parse forest.
 */
public abstract class TerminalOrEpsilon extends Symbol {
}
