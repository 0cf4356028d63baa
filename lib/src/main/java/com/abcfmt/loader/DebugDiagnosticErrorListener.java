package com.abcfmt.loader;

import java.util.BitSet;
import java.util.Locale;
import org.antlr.v4.runtime.DiagnosticErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.atn.ATNConfigSet;
import org.antlr.v4.runtime.dfa.DFA;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Records ambiguity and full-context reports from the ABC parser without failing the parse.
 *
 * <p>The stock {@link DiagnosticErrorListener} reports through {@link
 * Parser#notifyErrorListeners(String)}, which would reach {@link ThrowingErrorListener} and abort.
 * Here the messages are only captured through {@link DebugFlags} so grammar decisions can be
 * inspected from tests.</p>
 */
final class DebugDiagnosticErrorListener extends DiagnosticErrorListener {

    DebugDiagnosticErrorListener() {
        super(true);
    }

    @Override
    public void reportAmbiguity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            boolean exact,
            BitSet ambigAlts,
            ATNConfigSet configs) {
        if (exactOnly && !exact) {
            return;
        }
        BitSet conflicting = getConflictingAlts(ambigAlts, configs);
        capture("ambiguity", recognizer, dfa, startIndex, stopIndex, "alts=" + conflicting);
    }

    @Override
    public void reportAttemptingFullContext(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            BitSet conflictingAlts,
            ATNConfigSet configs) {
        capture("fullContext", recognizer, dfa, startIndex, stopIndex, "");
    }

    @Override
    public void reportContextSensitivity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            int prediction,
            ATNConfigSet configs) {
        capture("contextSensitivity", recognizer, dfa, startIndex, stopIndex, "alt=" + prediction);
    }

    private void capture(
            String kind, Parser recognizer, DFA dfa, int startIndex, int stopIndex, String detail) {
        String decision = getDecisionDescription(recognizer, dfa);
        String input = recognizer.getTokenStream().getText(Interval.of(startIndex, stopIndex));
        DebugFlags.captureDiagnostic(
                String.format(Locale.ROOT, "%s d=%s %s input='%s'", kind, decision, detail, input));
    }
}
