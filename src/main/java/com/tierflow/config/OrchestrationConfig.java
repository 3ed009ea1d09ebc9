package com.tierflow.config;

import com.tierflow.core.graph.NodeDefinition;
import com.tierflow.core.graph.NodeSelection;
import com.tierflow.core.graph.WorkflowGraph;
import com.tierflow.core.model.TaskState;
import com.tierflow.core.model.Tier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the pieces of the engine that are not plain component-scanned services.
 * <p>
 * Deployments replace the reference workflow by declaring their own {@link WorkflowGraph} bean.
 */
@Configuration
public class OrchestrationConfig {

    /** Lead score from which a qualified lead moves on to a proposal. */
    static final double QUALIFIED_LEAD_SCORE = 70;

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * Reference topology: lead qualification feeding proposal generation with management
     * review and executive approval as tier handlers, plus a parallel SEO audit that fans
     * out to three operational analyses and joins at the report.
     */
    @Bean
    @ConditionalOnMissingBean(WorkflowGraph.class)
    public WorkflowGraph workflowGraph(TierflowProperties properties) {
        var scheduler = properties.getScheduler();
        var graph = new WorkflowGraph(scheduler.getDefaultMaxRetries(), scheduler.getDefaultNodeTimeout());

        graph.addNode(NodeDefinition.builder("qualify")
                        .capability("lead_qualification")
                        .requires("company")
                        .build())
                .addNode("propose", "proposal_generation", Tier.OPERATIONAL)
                .addNode("review", "sales_operations", Tier.MANAGEMENT)
                .addNode("approve", "business_development", Tier.EXECUTIVE)
                .addNode(NodeDefinition.builder("audit")
                        .requires("domain")
                        .build())
                .addNode("technical_audit", "technical_seo_audit", Tier.OPERATIONAL)
                .addNode("competitive_analysis", "competitive_analysis", Tier.OPERATIONAL)
                .addNode("content_plan", "content_strategy", Tier.OPERATIONAL)
                .addNode("report", "reporting", Tier.OPERATIONAL);

        graph.addEdge("qualify", OrchestrationConfig::routeQualifiedLead, "propose")
                .addFanOut("audit", List.of("technical_audit", "competitive_analysis", "content_plan"), "report")
                .addSequentialEdge("technical_audit", "report")
                .addSequentialEdge("competitive_analysis", "report")
                .addSequentialEdge("content_plan", "report")
                .addEntryPoint("qualify")
                .addEntryPoint("audit")
                .setTierHandler(Tier.MANAGEMENT, "review")
                .setTierHandler(Tier.EXECUTIVE, "approve");
        return graph.validate();
    }

    static NodeSelection routeQualifiedLead(TaskState state) {
        Double score = state.numericField("lead_score");
        if (score != null && score >= QUALIFIED_LEAD_SCORE) {
            return NodeSelection.next("propose");
        }
        return NodeSelection.end();
    }
}
