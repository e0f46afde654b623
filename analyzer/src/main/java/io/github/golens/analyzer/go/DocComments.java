package io.github.golens.analyzer.go;

import io.github.golens.analyzer.SourceContent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import org.treesitter.TSNode;

/**
 * Doc comments in the Go sense: the run of comments that ends on the line directly above a declaration, with no
 * blank line in between.
 */
public final class DocComments {

    private DocComments() {}

    public static String docFor(TSNode declaration, SourceContent source) {
        var lines = new ArrayDeque<String>();
        int expectedEndRow = declaration.getStartPoint().getRow() - 1;
        var previous = declaration.getPrevNamedSibling();
        while (TreeSitterNodes.isPresent(previous)
                && GoTreeSitterNodeTypes.COMMENT.equals(previous.getType())
                && previous.getEndPoint().getRow() == expectedEndRow) {
            var commentLines = stripMarkers(source.substringFrom(previous));
            for (int i = commentLines.size() - 1; i >= 0; i--) {
                lines.addFirst(commentLines.get(i));
            }
            expectedEndRow = previous.getStartPoint().getRow() - 1;
            previous = previous.getPrevNamedSibling();
        }
        return String.join("\n", lines).strip();
    }

    static List<String> stripMarkers(String comment) {
        var result = new ArrayList<String>();
        if (comment.startsWith("//")) {
            result.add(dropLeadingSpace(comment.substring(2)));
            return result;
        }
        var body = comment;
        if (body.startsWith("/*")) body = body.substring(2);
        if (body.endsWith("*/")) body = body.substring(0, body.length() - 2);
        for (var line : body.split("\\R", -1)) {
            result.add(line.strip());
        }
        return result;
    }

    private static String dropLeadingSpace(String line) {
        var stripped = line.startsWith(" ") ? line.substring(1) : line;
        return stripped.stripTrailing();
    }
}
