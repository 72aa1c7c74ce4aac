// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.emit;

import ai.vespa.metriccompiler.lexer.Token;
import ai.vespa.metriccompiler.lexer.Tokenizer;
import ai.vespa.metriccompiler.model.Body;
import ai.vespa.metriccompiler.model.Level;
import ai.vespa.metriccompiler.model.MetricDescription;

import java.util.List;
import java.util.Optional;

/**
 * Produces the native source of a metric by copying a template and replacing the
 * marker comments in it by code generated from the metric description.
 * The leading comment of the template is replaced by a generated header.
 * Everything else is copied byte for byte.
 *
 * @author mcomp
 */
public class TemplateWeaver {

    private final MetricDescription metric;
    private final GeneratedHeader header;

    public TemplateWeaver(MetricDescription metric, GeneratedHeader header) {
        this.metric = metric;
        this.header = header;
    }

    public String weave(String template) {
        StringBuilder out = new StringBuilder(header.render(metric));
        boolean inTemplateHeader = true;
        for (String line : Indentation.linesWithTerminators(template)) {
            if (inTemplateHeader) {
                if (line.contains("*/"))
                    inTemplateHeader = false;
                continue;
            }
            weaveLine(line, out);
        }
        return out.toString();
    }

    private void weaveLine(String line, StringBuilder out) {
        List<Token> tokens = Tokenizer.tokenize(line);
        int column = Indentation.leadingWhitespace(line);
        int i = 0;
        while (i < tokens.size()) {
            int markerWord = nextNonWhitespace(tokens, i + 1);
            int commentEnd = nextNonWhitespace(tokens, markerWord + 1);
            Optional<Marker> marker = tokens.get(i).is("/*") && commentEnd < tokens.size() && tokens.get(commentEnd).is("*/")
                                      ? Marker.fromIdentifier(tokens.get(markerWord).text())
                                      : Optional.empty();
            if (marker.isPresent()) {
                emit(marker.get(), column, out);
                i = commentEnd + 1;
            }
            else {
                out.append(tokens.get(i).text());
                i++;
            }
        }
    }

    private static int nextNonWhitespace(List<Token> tokens, int from) {
        int i = from;
        while (i < tokens.size() && tokens.get(i).isWhitespace())
            i++;
        return i;
    }

    private void emit(Marker marker, int column, StringBuilder out) {
        out.append(marker.comment());
        if (marker == Marker.NAME) {
            out.append(" ").append(metric.name());
            return;
        }
        if (marker == Marker.DEPENDS_POST) {
            out.append(" ").append(metric.post().statements().size());
            return;
        }
        out.append("\n");

        CodeWriter writer = new CodeWriter(out);
        Body decode = metric.decode();
        Body post = metric.post();
        switch (marker) {
            case PRE:
                writer.fragments(metric.prerequisites(), column);
                break;
            case POST:
                writer.declarations(post, column, MacroSubstitution.macros(post.namespace()));
                writer.statements(post.statements(), Level.CONSTANT, column, MacroSubstitution.macros(post.namespace()));
                break;
            case POST_PER_DOC:
                writer.statements(post.statements(), Level.DOCUMENT, column, MacroSubstitution.macros(post.namespace()));
                break;
            case DECL:
                writer.declarations(decode, column, MacroSubstitution.macros(decode.namespace()));
                break;
            case PER_CALL:
                writer.statements(decode.statements(), Level.CONSTANT, column, MacroSubstitution.macros(decode.namespace()));
                break;
            case PER_DOC:
                writer.statements(decode.statements(), Level.DOCUMENT, column, MacroSubstitution.macros(decode.namespace()));
                writer.statements(decode.statements(), Level.TERM, column, MacroSubstitution.macros(decode.namespace()));
                break;
            case CONTRIB:
                writer.statements(decode.statements(), Level.DOCUMENT, column, MacroSubstitution.contributions(decode.namespace()));
                writer.statements(decode.statements(), Level.TERM, column, MacroSubstitution.contributions(decode.namespace()));
                break;
            default:
                throw new IllegalStateException("Unexpected marker " + marker);
        }
    }

}
