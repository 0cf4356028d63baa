package com.abcfmt.format;

import com.abcfmt.format.align.AlignmentException;
import com.abcfmt.format.align.SystemAligner;
import com.abcfmt.format.align.VoiceLine;
import com.abcfmt.loader.AbcAstBuilder;
import com.abcfmt.loader.AbcParseException;
import com.abcfmt.loader.ast.AbcFileNode;
import com.abcfmt.loader.ast.CommentLineNode;
import com.abcfmt.loader.ast.DirectiveLineNode;
import com.abcfmt.loader.ast.ElementNode;
import com.abcfmt.loader.ast.LineNode;
import com.abcfmt.loader.ast.TuneNode;
import com.abcfmt.loader.semantic.SemanticAnalysis;
import com.abcfmt.loader.semantic.SemanticAnalyzer;
import com.abcfmt.loader.semantic.TuneAnalysis;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pretty-prints ABC files. Music and symbol lines are respaced and, in tunes with two or more
 * voices, the lines of each system are aligned so that bars and simultaneous notes share columns.
 * Every other line is copied through.
 */
public final class AbcFormatter {
    private static final Logger LOGGER = Logger.getLogger(AbcFormatter.class.getName());

    static final String SYSTEM_COMMENTS_DIRECTIVE = "%%abcfmt system-comments";

    private final FormatterOptions options;
    private final AbcRenderer renderer;

    public AbcFormatter(FormatterOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.renderer = AbcRenderer.forOptions(options);
    }

    public AbcFormatter() {
        this(FormatterOptions.defaults());
    }

    public FormatterOptions getOptions() {
        return options;
    }

    public String format(String sourceName, String source) throws AbcParseException {
        AbcFileNode file = new AbcAstBuilder().parse(sourceName, source);
        return format(file, new SemanticAnalyzer().analyze(file));
    }

    public String format(AbcFileNode file, SemanticAnalysis analysis) {
        List<String> out = new ArrayList<>();
        copy(file.getFileHeader(), out);
        boolean fileWideComments = hasSystemCommentsDirective(file.getFileHeader());
        for (TuneNode tune : file.getTunes()) {
            copy(tune.getHeader(), out);
            TuneFormatter tuneFormatter =
                    new TuneFormatter(
                            analysis.getTune(tune),
                            file,
                            fileWideComments || hasSystemCommentsDirective(tune.getHeader()));
            tuneFormatter.formatBody(out);
            copy(tune.getTrailing(), out);
        }
        if (out.isEmpty()) {
            return "";
        }
        return String.join("\n", out) + "\n";
    }

    private static void copy(List<LineNode> lines, List<String> out) {
        for (LineNode line : lines) {
            out.add(line.getText().stripTrailing());
        }
    }

    private static boolean hasSystemCommentsDirective(List<LineNode> lines) {
        for (LineNode line : lines) {
            if (line instanceof DirectiveLineNode
                    && line.getText().trim().equals(SYSTEM_COMMENTS_DIRECTIVE)) {
                return true;
            }
        }
        return false;
    }

    private final class TuneFormatter {
        private final TuneAnalysis analysis;
        private final AbcFileNode file;
        private final boolean systemComments;
        private final SpacingRules spacing;
        private final MultiMeasureRestExpander expander;
        private final SystemAligner aligner;

        TuneFormatter(TuneAnalysis analysis, AbcFileNode file, boolean commentsDirective) {
            this.analysis = analysis;
            this.file = file;
            this.systemComments = options.isSystemComments() || commentsDirective;
            this.spacing = new SpacingRules(file.getIds());
            this.expander = new MultiMeasureRestExpander(file.getIds());
            this.aligner = new SystemAligner(renderer, file.getIds(), options.getStrategy());
        }

        void formatBody(List<String> out) {
            List<List<VoiceLine>> systems =
                    new SystemSplitter()
                            .split(analysis.getTune().getBody(), analysis.getInitialVoiceId());
            boolean multiVoice = analysis.isMultiVoice();
            for (int i = 0; i < systems.size(); i++) {
                List<VoiceLine> system = systems.get(i);
                normalize(system, multiVoice);
                if (multiVoice && options.isAlign()) {
                    align(system);
                }
                if (i > 0 && multiVoice && systemComments && !separated(systems.get(i - 1), system)) {
                    out.add("%");
                }
                for (VoiceLine line : system) {
                    out.add(render(line));
                }
            }
        }

        private void normalize(List<VoiceLine> system, boolean multiVoice) {
            for (VoiceLine line : system) {
                if (line.getKind() == VoiceLine.Kind.FORMATTED) {
                    List<ElementNode> spaced = spacing.spaceMusic(line.getElements());
                    if (multiVoice && options.isExpandMultiMeasureRests()) {
                        spaced = expander.expand(spaced);
                    }
                    line.replaceAll(spaced);
                } else if (line.getKind() == VoiceLine.Kind.SYMBOL) {
                    line.replaceAll(spacing.spaceSymbols(line.getElements()));
                }
            }
        }

        private void align(List<VoiceLine> system) {
            List<List<ElementNode>> before = new ArrayList<>();
            for (VoiceLine line : system) {
                before.add(new ArrayList<>(line.getElements()));
            }
            try {
                aligner.align(system, analysis.getTiming());
            } catch (AlignmentException ex) {
                if (!options.isFallbackToUnaligned()) {
                    throw ex;
                }
                LOGGER.log(
                        Level.WARNING,
                        "Alignment failed in "
                                + file.getSourceName()
                                + " near line "
                                + firstLine(system)
                                + "; leaving the system unaligned",
                        ex);
                for (int i = 0; i < system.size(); i++) {
                    system.get(i).replaceAll(before.get(i));
                }
            }
        }

        private String render(VoiceLine line) {
            if (line.getKind() == VoiceLine.Kind.PASSTHROUGH) {
                return line.getSource().getText().stripTrailing();
            }
            return line.render(renderer).stripTrailing();
        }
    }

    private static boolean separated(List<VoiceLine> previous, List<VoiceLine> next) {
        return isEmptyComment(previous.get(previous.size() - 1))
                || isEmptyComment(next.get(0));
    }

    private static boolean isEmptyComment(VoiceLine line) {
        return line.getSource() instanceof CommentLineNode comment
                && comment.getText().trim().equals("%");
    }

    private static int firstLine(List<VoiceLine> system) {
        for (VoiceLine line : system) {
            if (line.getSource() != null) {
                return line.getSource().getLocation().getLine();
            }
        }
        return 0;
    }
}
