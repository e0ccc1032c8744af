package net.grammarc.lexgen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import net.grammarc.grammar.LexerCommand;
import net.grammarc.grammar.Rule;
import net.grammarc.util.Formats;

/**
 * Reference scanner running a LexerAutomaton over a character sequence.
 * At each position the current mode's DFA is run for as long as it has
 * transitions; the input is then backtracked to the end of the longest
 * accepting prefix. Lexer commands of the matched alternative are applied:
 * skip drops the token, more carries its text over into the next token,
 * type and channel relabel it, and mode, pushMode and popMode switch the
 * DFA used from then on.
 */
public class Scanner {

    private final LexerAutomaton automaton;
    private final CharSequence input;
    private final Deque<String> modes;
    private int position;
    private boolean atEnd;

    public Scanner(LexerAutomaton automaton, CharSequence input) {
        if (automaton == null)
            throw new NullPointerException("Automaton may not be null");
        if (input == null)
            throw new NullPointerException("Input may not be null");
        this.automaton = automaton;
        this.input = input;
        this.modes = new ArrayDeque<String>();
        this.modes.push(Rule.DEFAULT_MODE);
        this.position = 0;
        this.atEnd = false;
    }

    public int getPosition() {
        return position;
    }

    public String getMode() {
        return modes.peek();
    }

    /* Runs the DFA of the current mode from position. Returns the end of
     * the longest non-empty match, or -1; the tag is stored in acceptOut. */
    protected int match(Dfa dfa, TokenAccept[] acceptOut) {
        LookupTable table = automaton.getTable();
        int state = dfa.getStart();
        int pos = position;
        int lastEnd = -1;
        while (pos < input.length()) {
            int cp = Character.codePointAt(input, pos);
            state = dfa.step(state, table.classOf(cp));
            if (state == Dfa.NO_STATE) break;
            pos += Character.charCount(cp);
            if (dfa.isAccepting(state)) {
                lastEnd = pos;
                acceptOut[0] = dfa.getAccept(state);
            }
        }
        return lastEnd;
    }

    protected void switchMode(LexerCommand cmd) throws ScanException {
        switch (cmd.getType()) {
            case MODE:
                modes.pop();
                modes.push(cmd.getArgument());
                break;
            case PUSH_MODE:
                modes.push(cmd.getArgument());
                break;
            case POP_MODE:
                if (modes.size() <= 1)
                    throw new ScanException("popMode with empty mode stack",
                                            position);
                modes.pop();
                break;
            default:
                break;
        }
    }

    /**
     * Scan the next token.
     * Returns an EOF token (repeatedly) once the input is exhausted.
     */
    public Token next() throws ScanException {
        int textStart = -1;
        for (;;) {
            if (position >= input.length()) {
                atEnd = true;
                return new Token(Token.EOF_TYPE, "", input.length(), null,
                                 getMode());
            }
            String mode = getMode();
            Dfa dfa = automaton.getDfa(mode);
            if (dfa == null)
                throw new ScanException("No tokens defined in mode " + mode,
                                        position);
            TokenAccept[] accept = new TokenAccept[1];
            int end = match(dfa, accept);
            if (end == -1)
                throw new ScanException("No token matches input at " +
                    "offset " + position + " (" + Formats.formatString(
                    input.subSequence(position, Math.min(position + 10,
                    input.length())).toString()) + "...)", position);
            if (textStart == -1) textStart = position;
            String type = accept[0].getTokenName();
            String channel = null;
            boolean skip = false, more = false;
            for (LexerCommand cmd : accept[0].getCommands()) {
                switch (cmd.getType()) {
                    case SKIP:
                        skip = true;
                        break;
                    case MORE:
                        more = true;
                        break;
                    case TYPE:
                        type = cmd.getArgument();
                        break;
                    case CHANNEL:
                        channel = cmd.getArgument();
                        break;
                    default:
                        switchMode(cmd);
                        break;
                }
            }
            position = end;
            if (skip) {
                textStart = -1;
                continue;
            }
            if (more) continue;
            return new Token(type, input.subSequence(textStart,
                end).toString(), textStart, channel, mode);
        }
    }

    /**
     * Whether next() has returned the EOF token.
     */
    public boolean isAtEnd() {
        return atEnd;
    }

    /**
     * Scan all remaining tokens, up to and including EOF.
     */
    public List<Token> tokenize() throws ScanException {
        List<Token> ret = new ArrayList<Token>();
        for (;;) {
            Token tok = next();
            ret.add(tok);
            if (tok.isEOF()) return ret;
        }
    }

}
