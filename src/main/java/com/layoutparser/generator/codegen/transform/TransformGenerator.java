package com.layoutparser.generator.codegen.transform;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.layoutparser.generator.codegen.ElementNames;
import com.layoutparser.generator.codegen.TemplateEngine;
import com.layoutparser.generator.config.GeneratorConfig;
import com.layoutparser.generator.exception.StructureException;
import com.layoutparser.generator.model.Layout;
import com.layoutparser.generator.model.LineDef;
import com.layoutparser.generator.model.LinkMapping;
import com.layoutparser.generator.model.Mapping;
import com.layoutparser.generator.model.expression.RuleAssignment;
import com.layoutparser.generator.parser.RuleExpressionParser;
import com.layoutparser.generator.parser.RuleParseResult;

/**
 * Generates an XSLT 1.0 stylesheet that turns the intermediate record into the output
 * document described by a mapping.
 *
 * Rule assignments become literal elements with computed content; link mappings become
 * ranked lookup chains with an optional default.
 */
public class TransformGenerator {

    private static final Logger log = LoggerFactory.getLogger(TransformGenerator.class);

    static final String TEMPLATE = "transform.xsl.ftl";
    private static final String INF_NFE = "infNFe";
    private static final String INF_NFE_VERSION = "4.00";

    private final GeneratorConfig config;
    private final RuleExpressionParser ruleParser;
    private final LookupCandidateRanker ranker;
    private final TemplateEngine templateEngine;
    private final XslPostProcessor postProcessor;

    public TransformGenerator(GeneratorConfig config, TemplateEngine templateEngine) {
        this.config = config;
        this.ruleParser = new RuleExpressionParser();
        this.ranker = new LookupCandidateRanker(config.getMaxLookupCandidates());
        this.templateEngine = templateEngine;
        this.postProcessor = new XslPostProcessor();
    }

    public GeneratedTransform generate(Mapping mapping, OutputProfile profile) {
        return generate(mapping, null, profile, Map.of());
    }

    /**
     * @param inputLayout  optional; its line names extend the lookup search
     * @param learnedHints element name to preferred XPath, tried before the ranked candidates
     */
    public GeneratedTransform generate(Mapping mapping, Layout inputLayout, OutputProfile profile,
            Map<String, String> learnedHints) {
        if (config.isPreferEmbeddedXsl() && mapping.hasEmbeddedXsl()) {
            log.info("Using XSL embedded in mapper {}", mapping.getName());
            return GeneratedTransform.builder()
                    .stylesheet(postProcessor.clean(mapping.getEmbeddedXsl()))
                    .rootElement(profile.getRootElement())
                    .namespace(profile.getNamespace())
                    .fromEmbeddedXsl(true)
                    .build();
        }
        if (mapping.isEmpty()) {
            throw new StructureException("Mapping " + mapping.getName() + " has no rules or link mappings");
        }

        List<String> warnings = new ArrayList<>();
        RuleParseResult parsed = ruleParser.parse(mapping.getRules());
        warnings.addAll(parsed.getWarnings());

        OutputNode root = OutputNode.element(ElementNames.sanitize(profile.getRootElement()));
        root.setNamespace(profile.getNamespace());
        seedStructure(root, profile);

        for (RuleAssignment assignment : parsed.getAllAssignments()) {
            OutputNode node = resolve(root, profile, assignment.targetSegments());
            node.setValueXsl(assignment.getExpression().accept(new XslValueWriter(assignment.getTargetPath(), warnings)));
            node.setLookup(null);
        }

        List<String> inputLines = inputLayout == null ? List.of()
                : inputLayout.getLines().stream().map(LineDef::getName).toList();
        List<LookupPlan> plans = new ArrayList<>();
        for (LinkMapping link : mapping.orderedLinkMappings()) {
            if (link.getName() == null || link.getName().isBlank()) {
                warnings.add("Link mapping at sequence " + link.getSequence() + " has no name, skipped");
                continue;
            }
            LookupPlan plan = ranker.plan(link, inputLines, learnedHints);
            OutputNode node = resolve(root, profile, plan.getTargetSegments());
            if (node.getValueXsl() != null) {
                warnings.add("Element " + plan.getElementName() + " is already assigned by a rule, link mapping "
                        + link.getName() + " ignored");
                continue;
            }
            node.setLookup(plan);
            plans.add(plan);
        }

        String body = new XslBodyWriter().write(root);
        Map<String, Object> model = new HashMap<>();
        model.put("mappingName", mapping.getName() == null ? "" : XslExpressions.commentText(mapping.getName()));
        model.put("body", body);
        String stylesheet = postProcessor.clean(templateEngine.render(TEMPLATE, model));

        log.debug("Generated transform for {}: {} assignments, {} lookups, {} warnings",
                mapping.getName(), parsed.getAssignments().size(), plans.size(), warnings.size());

        return GeneratedTransform.builder()
                .stylesheet(stylesheet)
                .rootElement(profile.getRootElement())
                .namespace(profile.getNamespace())
                .assignmentCount(parsed.getAssignments().size())
                .lookupPlans(plans)
                .warnings(warnings)
                .build();
    }

    private void seedStructure(OutputNode root, OutputProfile profile) {
        OutputNode document = root;
        if (profile.isBatchWrapper()) {
            LookupPlan batchId = ranker.plan(LinkMapping.builder().name("idLote").defaultValue("1").build(),
                    List.of(), Map.of());
            root.child("idLote", false).setLookup(batchId);
            root.child("indSinc", false).setValueXsl("<xsl:text>0</xsl:text>");
            document = root.child(ElementNames.sanitize(profile.getDocumentElement()), false);
        }
        if (profile.isFiscalDocument()) {
            OutputNode infNFe = document.child(INF_NFE, false);
            infNFe.child("versao", true).setValueXsl("<xsl:text>" + INF_NFE_VERSION + "</xsl:text>");
            infNFe.child("Id", true).setValueXsl(
                    "<xsl:value-of select=\"concat('NFe', normalize-space(ROOT/chave/chNFe))\"/>");
        }
    }

    /**
     * Walks (creating as needed) the node for a target path. The root element name is
     * optional in paths; in batch mode paths without the document element are placed under it.
     */
    private OutputNode resolve(OutputNode root, OutputProfile profile, List<String> rawSegments) {
        List<String> segments = new ArrayList<>(rawSegments);
        if (!segments.isEmpty() && segments.get(0).equals(profile.getRootElement())) {
            segments.remove(0);
        }
        if (profile.isBatchWrapper() && !segments.isEmpty()
                && !segments.get(0).equals(profile.getDocumentElement())
                && !OutputProfile.BATCH_MARKERS.contains(segments.get(0))) {
            segments.add(0, profile.getDocumentElement());
        }

        OutputNode node = root;
        for (String segment : segments) {
            boolean attribute = segment.startsWith("@");
            node = node.child(attribute ? attributeName(segment.substring(1)) : ElementNames.sanitize(segment), attribute);
        }
        return node;
    }

    private static String attributeName(String raw) {
        if (raw.startsWith("xsi:")) {
            return "xsi:" + ElementNames.sanitize(raw.substring(4));
        }
        return ElementNames.sanitize(raw);
    }
}
