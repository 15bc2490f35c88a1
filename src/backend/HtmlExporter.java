package backend;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import exception.CompileException;
import ir.Plan;
import ir.PlanSerializer;
import util.logging.LogManager;
import util.logging.Logger;

/**
 * Self-contained HTML page drawing the plan with dagre-d3. The page template
 * lives in {@code backend/dagre.html} on the classpath.
 */
public class HtmlExporter {
    private static final Logger logger = LogManager.getLogger(HtmlExporter.class);
    private static final HtmlExporter instance = new HtmlExporter();

    static final String TEMPLATE = "/backend/dagre.html";
    private static final Pattern PLACEHOLDER = Pattern.compile("__(PLAN_JSON|GRAPH_JSON|COLOR_MAP|FUNCTION)__");

    // default html escaping keeps "</script>" in user text from closing the tag
    private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();
    private String template;

    private HtmlExporter() {
    }

    public static HtmlExporter getInstance() {
        return instance;
    }

    public String printToString(Plan plan) {
        Map<String, String> values = Map.of(
                "PLAN_JSON", gson.toJson(PlanSerializer.toJsonTree(plan)),
                "GRAPH_JSON", gson.toJson(GraphRenderer.getInstance().render(plan).toJsonTree()),
                "COLOR_MAP", gson.toJson(NodeColors.colorMap(plan)),
                "FUNCTION", plan.getFunction() == null ? "" : plan.getFunction());

        // one pass over the template so substituted JSON is never rescanned
        Matcher matcher = PLACEHOLDER.matcher(template());
        StringBuilder html = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(html, Matcher.quoteReplacement(values.get(matcher.group(1))));
        }
        matcher.appendTail(html);
        return html.toString();
    }

    /**
     * @return the written path
     */
    public Path printToFile(Plan plan, Path file) {
        try {
            Files.writeString(file, printToString(plan), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw CompileException.io("cannot write " + file, e);
        }
        logger.debug("wrote {}", file);
        return file;
    }

    private synchronized String template() {
        if (template == null) {
            try (InputStream in = HtmlExporter.class.getResourceAsStream(TEMPLATE)) {
                if (in == null) {
                    throw CompileException.io("missing resource " + TEMPLATE, null);
                }
                template = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw CompileException.io("cannot read " + TEMPLATE, e);
            }
        }
        return template;
    }
}
