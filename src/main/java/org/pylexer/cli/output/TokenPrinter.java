package org.pylexer.cli.output;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.pylexer.lexer.ScanResult;
import org.pylexer.lexer.Token;
import org.pylexer.lexer.TokenType;

import java.io.PrintWriter;
import java.util.List;

/**
 * Renders lexer output for the command line.
 */
public class TokenPrinter {

    private final OutputFormat format;
    private final boolean showErrors;

    public TokenPrinter(OutputFormat format, boolean showErrors) {
        this.format = format;
        this.showErrors = showErrors;
    }

    public void print(List<ScanResult> results, PrintWriter out) {
        if (format == OutputFormat.JSON) {
            printJson(results, out);
        } else {
            printText(results, out);
        }
        out.flush();
    }

    private void printText(List<ScanResult> results, PrintWriter out) {
        for (ScanResult result : results) {
            if (result.isOk()) {
                Token token = result.token();
                String payload = token.type().category() == TokenType.Category.LAYOUT ? "" : token.displayText();
                out.println(String.format("%5d  %-20s %s", result.line(), token.type(), payload).stripTrailing());
            } else if (showErrors) {
                out.println(String.format("%5d  %-20s %s", result.line(), "ERROR", result.error()));
            }
        }
    }

    private void printJson(List<ScanResult> results, PrintWriter out) {
        JsonArray items = new JsonArray();
        for (ScanResult result : results) {
            if (result.isError() && !showErrors) {
                continue;
            }
            JsonObject item = new JsonObject();
            item.addProperty("line", result.line());
            if (result.isOk()) {
                Token token = result.token();
                item.addProperty("type", token.type().name());
                if (token.type() == TokenType.BYTES) {
                    JsonArray bytes = new JsonArray();
                    for (byte b : token.bytes()) {
                        bytes.add(b & 0xFF);
                    }
                    item.add("bytes", bytes);
                } else if (token.text() != null) {
                    item.addProperty("text", token.text());
                }
            } else {
                item.addProperty("error", result.error().kind().name());
                if (result.error().detail() != null) {
                    item.addProperty("detail", result.error().detail());
                }
            }
            items.add(item);
        }
        Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        out.println(gson.toJson(items));
    }
}
