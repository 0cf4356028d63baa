package com.abcfmt.loader;

import com.abcfmt.loader.ast.AbcFileNode;
import com.abcfmt.loader.ast.AnnotationNode;
import com.abcfmt.loader.ast.BarLineNode;
import com.abcfmt.loader.ast.BeamNode;
import com.abcfmt.loader.ast.BlankLineNode;
import com.abcfmt.loader.ast.ChordNode;
import com.abcfmt.loader.ast.CommentLineNode;
import com.abcfmt.loader.ast.CommentNode;
import com.abcfmt.loader.ast.DecorationNode;
import com.abcfmt.loader.ast.DirectiveLineNode;
import com.abcfmt.loader.ast.ElementNode;
import com.abcfmt.loader.ast.GraceGroupNode;
import com.abcfmt.loader.ast.InfoLineNode;
import com.abcfmt.loader.ast.InlineFieldNode;
import com.abcfmt.loader.ast.LineNode;
import com.abcfmt.loader.ast.MarkerNode;
import com.abcfmt.loader.ast.MultiMeasureRestNode;
import com.abcfmt.loader.ast.MusicLineNode;
import com.abcfmt.loader.ast.NodeIds;
import com.abcfmt.loader.ast.NoteNode;
import com.abcfmt.loader.ast.Pitch;
import com.abcfmt.loader.ast.RestNode;
import com.abcfmt.loader.ast.Rhythm;
import com.abcfmt.loader.ast.SourceLocation;
import com.abcfmt.loader.ast.SymbolHeaderNode;
import com.abcfmt.loader.ast.SymbolLineNode;
import com.abcfmt.loader.ast.SymbolTokenNode;
import com.abcfmt.loader.ast.TuneNode;
import com.abcfmt.loader.ast.TupletNode;
import com.abcfmt.loader.ast.WhitespaceNode;
import com.abcfmt.loader.grammar.AbcLexer;
import com.abcfmt.loader.grammar.AbcParser;
import com.abcfmt.loader.grammar.AbcParserBaseVisitor;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

/** Parses ABC text with the generated ANTLR parser and converts the parse tree into the AST. */
public final class AbcAstBuilder {

    public AbcFileNode parse(String sourceName, String input) throws AbcParseException {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(input, "input");
        String terminated = input.endsWith("\n") ? input : input + "\n";
        CharStream stream = CharStreams.fromString(terminated, sourceName);
        return parse(sourceName, stream);
    }

    private AbcFileNode parse(String sourceName, CharStream input) throws AbcParseException {
        AbcLexer lexer = new AbcLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        AbcParser parser = new AbcParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);
        if (DebugFlags.isParserTraceEnabled()) {
            parser.addErrorListener(DebugFlags.diagnosticListener());
        }

        try {
            if (DebugFlags.isTokenDebugEnabled()) {
                tokens.fill();
                DebugFlags.logTokens(tokens, lexer);
                tokens.seek(0);
            }
            AbcParser.AbcFileContext context = parser.abcFile();
            NodeIds ids = new NodeIds();
            AstBuildingVisitor visitor = new AstBuildingVisitor(sourceName, ids);
            List<LineNode> lines = visitor.build(context);
            return assemble(sourceName, lines, ids);
        } catch (ParseCancellationException ex) {
            throw new AbcParseException(ex.getMessage(), ex);
        }
    }

    /**
     * Splits the flat line list into the file header and tunes. A tune opens at {@code X:} and a
     * blank line closes it. Its header takes field, comment and directive lines and ends after the
     * first {@code K:}, before a {@code V:} that repeats an already declared voice, or before the
     * first line of music. Input without any {@code X:} is treated as a single tune fragment.
     */
    static AbcFileNode assemble(String sourceName, List<LineNode> lines, NodeIds ids) {
        List<LineNode> fileHeader = new ArrayList<>();
        List<TuneNode> tunes = new ArrayList<>();
        boolean hasTuneStart = lines.stream().anyMatch(AbcAstBuilder::isTuneStart);
        int index = 0;
        if (hasTuneStart) {
            while (index < lines.size() && !isTuneStart(lines.get(index))) {
                fileHeader.add(lines.get(index++));
            }
        }
        while (index < lines.size()) {
            SourceLocation location = lines.get(index).getLocation();
            List<LineNode> header = new ArrayList<>();
            List<LineNode> body = new ArrayList<>();
            List<LineNode> trailing = new ArrayList<>();
            Set<String> declaredVoices = new HashSet<>();
            boolean inHeader = true;
            while (index < lines.size() && !(lines.get(index) instanceof BlankLineNode)) {
                LineNode line = lines.get(index);
                if (inHeader && !endsHeader(line, declaredVoices)) {
                    header.add(line);
                    if (line instanceof InfoLineNode info && info.isKey('K')) {
                        inHeader = false;
                    }
                } else {
                    inHeader = false;
                    body.add(line);
                }
                index++;
            }
            while (index < lines.size()
                    && !isTuneStart(lines.get(index))
                    && (hasTuneStart || lines.get(index) instanceof BlankLineNode)) {
                trailing.add(lines.get(index++));
            }
            tunes.add(new TuneNode(location, header, body, trailing));
        }
        return new AbcFileNode(sourceName, fileHeader, tunes, ids);
    }

    private static boolean isTuneStart(LineNode line) {
        return line instanceof InfoLineNode info && info.isKey('X');
    }

    private static boolean endsHeader(LineNode line, Set<String> declaredVoices) {
        if (line instanceof InfoLineNode info) {
            return info.isKey('V') && !declaredVoices.add(info.getFirstWord());
        }
        return !(line instanceof CommentLineNode || line instanceof DirectiveLineNode);
    }

    /**
     * Groups runs of two or more time-bearing elements written without whitespace into beams.
     * Decorations, annotations, grace groups, slurs and tuplet markers may sit inside a run; a run
     * starts at its first time-bearing element and ends at its last one.
     */
    static List<ElementNode> groupBeams(List<ElementNode> raw, NodeIds ids) {
        List<ElementNode> result = new ArrayList<>();
        int index = 0;
        while (index < raw.size()) {
            ElementNode node = raw.get(index);
            if (!node.isTimeBearing() || !isBeamable(node)) {
                result.add(node);
                index++;
                continue;
            }
            int last = index;
            int members = 1;
            for (int j = index + 1; j < raw.size() && isBeamable(raw.get(j)); j++) {
                if (raw.get(j).isTimeBearing()) {
                    last = j;
                    members++;
                }
            }
            if (members >= 2) {
                List<ElementNode> contents = raw.subList(index, last + 1);
                result.add(new BeamNode(ids.next(), node.getLocation(), contents));
                index = last + 1;
            } else {
                result.add(node);
                index++;
            }
        }
        return result;
    }

    private static boolean isBeamable(ElementNode node) {
        if (node instanceof MarkerNode marker) {
            return marker.getKind() == MarkerNode.Kind.SLUR_OPEN
                    || marker.getKind() == MarkerNode.Kind.SLUR_CLOSE;
        }
        return node instanceof NoteNode
                || node instanceof ChordNode
                || node instanceof RestNode
                || node instanceof GraceGroupNode
                || node instanceof DecorationNode
                || node instanceof AnnotationNode
                || node instanceof TupletNode;
    }

    private static final class AstBuildingVisitor extends AbcParserBaseVisitor<Void> {
        private final String sourceName;
        private final NodeIds ids;
        private final List<LineNode> lines = new ArrayList<>();

        AstBuildingVisitor(String sourceName, NodeIds ids) {
            this.sourceName = sourceName;
            this.ids = ids;
        }

        List<LineNode> build(AbcParser.AbcFileContext context) {
            visitAbcFile(context);
            return lines;
        }

        @Override
        public Void visitAbcFile(AbcParser.AbcFileContext ctx) {
            for (AbcParser.LineContext lineContext : ctx.line()) {
                visit(lineContext);
            }
            return null;
        }

        @Override
        public Void visitInfoLine(AbcParser.InfoLineContext ctx) {
            Token token = ctx.INFO_FIELD().getSymbol();
            lines.add(new InfoLineNode(location(token), stripTrailingBlanks(token.getText())));
            return null;
        }

        @Override
        public Void visitDirectiveLine(AbcParser.DirectiveLineContext ctx) {
            Token token = ctx.DIRECTIVE().getSymbol();
            lines.add(new DirectiveLineNode(location(token), stripTrailingBlanks(token.getText())));
            return null;
        }

        @Override
        public Void visitCommentLine(AbcParser.CommentLineContext ctx) {
            Token token = ctx.COMMENT().getSymbol();
            lines.add(new CommentLineNode(location(token), stripTrailingBlanks(token.getText())));
            return null;
        }

        @Override
        public Void visitBlankLine(AbcParser.BlankLineContext ctx) {
            lines.add(new BlankLineNode(location(ctx.getStart())));
            return null;
        }

        @Override
        public Void visitSymbolLine(AbcParser.SymbolLineContext ctx) {
            Token headerToken = ctx.symbolHeader().getStart();
            List<ElementNode> elements = new ArrayList<>();
            elements.add(
                    new SymbolHeaderNode(ids.next(), location(headerToken), headerToken.getText()));
            for (AbcParser.SymbolItemContext item : ctx.symbolItem()) {
                elements.add(symbolItem(item.getStart()));
            }
            if (ctx.SYMBOL_COMMENT() != null) {
                Token comment = ctx.SYMBOL_COMMENT().getSymbol();
                elements.add(new CommentNode(ids.next(), location(comment), comment.getText()));
            }
            lines.add(new SymbolLineNode(location(headerToken), elements));
            return null;
        }

        @Override
        public Void visitMusicLine(AbcParser.MusicLineContext ctx) {
            List<ElementNode> raw = new ArrayList<>();
            for (AbcParser.ElementContext element : ctx.element()) {
                raw.add(element(element));
            }
            SourceLocation lineLocation = location(ctx.getStart());
            boolean blank = raw.stream().allMatch(ElementNode::isWhitespace);
            if (ctx.COMMENT() != null) {
                Token comment = ctx.COMMENT().getSymbol();
                raw.add(new CommentNode(ids.next(), location(comment), comment.getText()));
            } else if (blank) {
                lines.add(new BlankLineNode(lineLocation));
                return null;
            }
            lines.add(new MusicLineNode(lineLocation, groupBeams(raw, ids)));
            return null;
        }

        private ElementNode symbolItem(Token token) {
            SourceLocation location = location(token);
            switch (token.getType()) {
                case AbcLexer.SYMBOL_WS:
                    return new WhitespaceNode(ids.next(), location, token.getText());
                case AbcLexer.SYMBOL_BAR:
                    return new SymbolTokenNode(
                            ids.next(), location, SymbolTokenNode.Kind.BAR, token.getText());
                case AbcLexer.SYMBOL_SKIP:
                    return new SymbolTokenNode(
                            ids.next(), location, SymbolTokenNode.Kind.SKIP, token.getText());
                case AbcLexer.SYMBOL_TEXT:
                    return new SymbolTokenNode(
                            ids.next(), location, SymbolTokenNode.Kind.TEXT, token.getText());
                default:
                    throw unexpected(token);
            }
        }

        private ElementNode element(AbcParser.ElementContext ctx) {
            if (ctx.note() != null) {
                return note(ctx.note());
            }
            if (ctx.rest() != null) {
                Token token = ctx.rest().REST().getSymbol();
                return new RestNode(
                        ids.next(),
                        location(token),
                        token.getText().charAt(0),
                        rhythm(ctx.rest().rhythm()));
            }
            if (ctx.multiRest() != null) {
                Token token = ctx.multiRest().MULTI_REST().getSymbol();
                TerminalNode count = ctx.multiRest().NUMBER();
                return new MultiMeasureRestNode(
                        ids.next(),
                        location(token),
                        token.getText().charAt(0),
                        count == null ? null : count.getText());
            }
            if (ctx.chord() != null) {
                return chord(ctx.chord());
            }
            if (ctx.graceGroup() != null) {
                AbcParser.GraceGroupContext grace = ctx.graceGroup();
                List<NoteNode> notes = new ArrayList<>();
                for (AbcParser.NoteContext note : grace.note()) {
                    notes.add(note(note));
                }
                return new GraceGroupNode(
                        ids.next(),
                        location(grace.getStart()),
                        grace.GRACE_OPEN().getText().length() > 1,
                        notes);
            }
            Token token = ctx.getStart();
            SourceLocation location = location(token);
            String text = token.getText();
            switch (token.getType()) {
                case AbcLexer.TUPLET:
                    return tuplet(token);
                case AbcLexer.BARLINE:
                    return new BarLineNode(ids.next(), location, text);
                case AbcLexer.DECORATION:
                    return new DecorationNode(ids.next(), location, text);
                case AbcLexer.ANNOTATION:
                    return new AnnotationNode(ids.next(), location, text);
                case AbcLexer.INLINE_FIELD:
                    return new InlineFieldNode(ids.next(), location, text);
                case AbcLexer.SLUR_OPEN:
                    return new MarkerNode(ids.next(), location, MarkerNode.Kind.SLUR_OPEN);
                case AbcLexer.SLUR_CLOSE:
                    return new MarkerNode(ids.next(), location, MarkerNode.Kind.SLUR_CLOSE);
                case AbcLexer.SPACER:
                    return new MarkerNode(ids.next(), location, MarkerNode.Kind.SPACER);
                case AbcLexer.OVERLAY:
                    return new MarkerNode(ids.next(), location, MarkerNode.Kind.OVERLAY);
                case AbcLexer.CONTINUATION:
                    return new MarkerNode(ids.next(), location, MarkerNode.Kind.CONTINUATION);
                case AbcLexer.WS:
                    return new WhitespaceNode(ids.next(), location, text);
                default:
                    throw unexpected(token);
            }
        }

        private NoteNode note(AbcParser.NoteContext ctx) {
            AbcParser.PitchContext pitchContext = ctx.pitch();
            Pitch pitch =
                    new Pitch(
                            textOrNull(pitchContext.ACCIDENTAL()),
                            pitchContext.NOTE_LETTER().getText().charAt(0),
                            textOrNull(pitchContext.OCTAVE()));
            return new NoteNode(
                    ids.next(),
                    location(ctx.getStart()),
                    pitch,
                    rhythm(ctx.rhythm()),
                    ctx.TIE() != null);
        }

        private ChordNode chord(AbcParser.ChordContext ctx) {
            List<NoteNode> notes = new ArrayList<>();
            for (AbcParser.NoteContext note : ctx.note()) {
                notes.add(note(note));
            }
            return new ChordNode(
                    ids.next(),
                    location(ctx.getStart()),
                    notes,
                    rhythm(ctx.rhythm()),
                    ctx.TIE() != null);
        }

        private Rhythm rhythm(AbcParser.RhythmContext ctx) {
            if (ctx == null) {
                return Rhythm.NONE;
            }
            String numerator = null;
            String slashes = "";
            String denominator = null;
            String broken = null;
            for (ParseTree child : ctx.children) {
                Token token = ((TerminalNode) child).getSymbol();
                switch (token.getType()) {
                    case AbcLexer.NUMBER:
                        if (slashes.isEmpty()) {
                            numerator = token.getText();
                        } else {
                            denominator = token.getText();
                        }
                        break;
                    case AbcLexer.SLASH:
                        slashes = token.getText();
                        break;
                    case AbcLexer.BROKEN:
                        broken = token.getText();
                        break;
                    default:
                        throw unexpected(token);
                }
            }
            return new Rhythm(numerator, slashes, denominator, broken);
        }

        private TupletNode tuplet(Token token) {
            String text = token.getText();
            String[] parts = text.substring(1).split(":", -1);
            try {
                int p = Integer.parseInt(parts[0]);
                Integer q = parts.length > 1 && !parts[1].isEmpty() ? Integer.valueOf(parts[1]) : null;
                Integer r = parts.length > 2 && !parts[2].isEmpty() ? Integer.valueOf(parts[2]) : null;
                return new TupletNode(ids.next(), location(token), text, p, q, r);
            } catch (NumberFormatException ex) {
                throw new ParseCancellationException(
                        "line "
                                + token.getLine()
                                + ":"
                                + (token.getCharPositionInLine() + 1)
                                + " invalid tuplet "
                                + text,
                        ex);
            }
        }

        private ParseCancellationException unexpected(Token token) {
            return new ParseCancellationException(
                    "line "
                            + token.getLine()
                            + ":"
                            + (token.getCharPositionInLine() + 1)
                            + " unexpected token '"
                            + token.getText()
                            + "'");
        }

        private SourceLocation location(Token token) {
            return SourceLocation.of(sourceName, token);
        }

        private static String textOrNull(TerminalNode node) {
            return node == null ? null : node.getText();
        }

        private static String stripTrailingBlanks(String text) {
            int end = text.length();
            while (end > 0 && (text.charAt(end - 1) == ' ' || text.charAt(end - 1) == '\t')) {
                end--;
            }
            return text.substring(0, end);
        }
    }
}
