package com.formatengine.plugins.json;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.formatengine.api.FormatterException;
import com.formatengine.ir.Conditions;
import com.formatengine.ir.IrHelpers;
import com.formatengine.ir.PrintItems;
import com.formatengine.ir.Signal;
import com.formatengine.ir.WriterInfo;

/**
 * Builds print items from a JSON token stream.
 *
 * <p>An object or array is laid out one member per line when its first member starts on a
 * later line than the opening token. Otherwise the members stay on the opening line and wrap
 * only when they would exceed the line width. Nested containers form a new-line group so the
 * breaks around them are taken before the breaks inside them.</p>
 */
final class JsonIrGenerator {
    private final JsonParser parser;

    JsonIrGenerator(JsonParser parser) {
        this.parser = parser;
    }

    PrintItems generate() throws IOException, FormatterException {
        PrintItems items = new PrintItems();
        JsonToken token = parser.nextToken();
        if (token == null) {
            return items;
        }

        _genValue(items, token);

        if (parser.nextToken() != null) {
            JsonLocation location = parser.getTokenLocation();
            throw new FormatterException("Unexpected content after the root value",
                    location.getLineNr(), location.getColumnNr(), null);
        }

        items.push(Conditions.ifTrue("endOfFileNewLine", context -> {
            WriterInfo writerInfo = context.getWriterInfo();
            return writerInfo.getColumnNumber() > 0 || writerInfo.getLineNumber() > 0;
        }, PrintItems.of(Signal.NEW_LINE)));
        return items;
    }

    private void _genValue(PrintItems items, JsonToken token) throws IOException, FormatterException {
        switch (token) {
            case START_OBJECT -> items.pushAll(IrHelpers.newLineGroup(_genObject()));
            case START_ARRAY -> items.pushAll(IrHelpers.newLineGroup(_genArray()));
            case VALUE_STRING -> items.push(_quote(parser.getText()));
            case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT, VALUE_TRUE, VALUE_FALSE, VALUE_NULL ->
                    items.push(parser.getText());
            default -> {
                JsonLocation location = parser.getTokenLocation();
                throw new FormatterException("Unexpected token: " + token,
                        location.getLineNr(), location.getColumnNr(), null);
            }
        }
    }

    private PrintItems _genObject() throws IOException, FormatterException {
        int openLine = parser.getTokenLocation().getLineNr();
        JsonToken token = parser.nextToken();
        if (token == JsonToken.END_OBJECT) {
            return PrintItems.of().push("{}");
        }

        boolean multiLine = parser.getTokenLocation().getLineNr() > openLine;
        List<PrintItems> members = new ArrayList<>();
        while (token == JsonToken.FIELD_NAME) {
            PrintItems member = new PrintItems();
            member.push(_quote(parser.currentName()) + ": ");
            _genValue(member, parser.nextToken());
            members.add(member);
            token = parser.nextToken();
        }
        return _genMembers("{", "}", members, multiLine, true);
    }

    private PrintItems _genArray() throws IOException, FormatterException {
        int openLine = parser.getTokenLocation().getLineNr();
        JsonToken token = parser.nextToken();
        if (token == JsonToken.END_ARRAY) {
            return PrintItems.of().push("[]");
        }

        boolean multiLine = parser.getTokenLocation().getLineNr() > openLine;
        List<PrintItems> elements = new ArrayList<>();
        while (token != JsonToken.END_ARRAY) {
            PrintItems element = new PrintItems();
            _genValue(element, token);
            elements.add(element);
            token = parser.nextToken();
        }
        return _genMembers("[", "]", elements, multiLine, false);
    }

    private PrintItems _genMembers(String open, String close, List<PrintItems> members, boolean multiLine,
                                   boolean padded) {
        PrintItems items = new PrintItems();
        PrintItems inner = new PrintItems();

        if (multiLine) {
            items.push(open);
            for (int i = 0; i < members.size(); i++) {
                inner.push(Signal.NEW_LINE);
                inner.pushAll(members.get(i));
                if (i < members.size() - 1) {
                    inner.push(",");
                }
            }
            items.pushAll(IrHelpers.withIndent(inner));
            items.push(Signal.NEW_LINE);
            items.push(close);
            return items;
        }

        items.push(padded ? open + " " : open);
        for (int i = 0; i < members.size(); i++) {
            if (i > 0) {
                inner.push(Signal.SPACE_OR_NEW_LINE);
            }
            inner.pushAll(members.get(i));
            if (i < members.size() - 1) {
                inner.push(",");
            }
        }
        items.pushAll(IrHelpers.withIndent(inner));
        items.push(padded ? " " + close : close);
        return items;
    }

    private static String _quote(String value) {
        return "\"" + new String(JsonStringEncoder.getInstance().quoteAsString(value)) + "\"";
    }
}
