package com.decisionswarm.swarm.prompt;

import com.decisionswarm.common.model.SwarmAgent;
import com.decisionswarm.common.model.Task;
import com.decisionswarm.common.model.TaskType;
import com.decisionswarm.swarm.parse.ResponseSchema;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Renders the prompt for one agent and one task.
 *
 * <p>The output depends only on the agent's specialization, the task type and the payload.
 * Map keys are written in sorted order and the task id is left out, so the same inputs
 * always give the same text.
 */
@Component
public class PromptFactory {

    private static final Map<String, SpecializationBrief> BRIEFS = Map.ofEntries(
        // intent
        Map.entry("operations_research", SpecializationBrief.of(
            "an operations research specialist in mathematical optimization and linear programming",
            "capacity planning", "cost optimization", "production scheduling")),
        Map.entry("production_systems", SpecializationBrief.of(
            "a production systems specialist in manufacturing operations and line efficiency",
            "production scheduling", "throughput and bottlenecks", "maintenance planning")),
        Map.entry("supply_chain", SpecializationBrief.of(
            "a supply chain specialist in logistics and inventory management",
            "inventory optimization", "supplier and distribution decisions", "demand variability")),
        Map.entry("quality_control", SpecializationBrief.of(
            "a quality control specialist in process capability and defect reduction",
            "quality control", "inspection and rework", "maintenance impact on quality")),
        Map.entry("sustainability", SpecializationBrief.of(
            "a sustainability specialist in energy use and environmental impact",
            "environmental optimization", "energy and emissions", "waste reduction")),
        // data
        Map.entry("data_requirements", SpecializationBrief.of(
            "a data requirements analyst for optimization models",
            "entities and attributes the model needs", "units and granularity", "missing inputs")),
        Map.entry("business_context", SpecializationBrief.of(
            "a business analyst who frames operational decisions",
            "business rules that become constraints", "stakeholder objectives", "realistic assumptions")),
        Map.entry("sample_data_generation", SpecializationBrief.of(
            "a data engineer who produces representative sample data",
            "plausible value ranges", "consistency between entities", "edge cases worth testing")),
        // model
        Map.entry("mathematical_formulation", SpecializationBrief.of(
            "a mathematical modeler",
            "decision variables and their domains", "objective function", "model class selection")),
        Map.entry("constraint_modeling", SpecializationBrief.of(
            "a constraint modeling specialist",
            "capacity and resource constraints", "logical and precedence constraints", "tightness of formulation")),
        Map.entry("solver_compatibility", SpecializationBrief.of(
            "a solver compatibility specialist",
            "linearity of the formulation", "integrality requirements", "solver-friendly reformulations")),
        Map.entry("optimization_research", SpecializationBrief.of(
            "an optimization researcher",
            "known formulations for this problem class", "decomposition opportunities", "model size and tractability")),
        // solver
        Map.entry("or_tools_glop", SpecializationBrief.of(
            "a linear programming expert using the GLOP simplex solver",
            "continuous relaxations", "feasibility of the linear model", "objective value")),
        Map.entry("or_tools_scip", SpecializationBrief.of(
            "a mixed integer programming expert using the SCIP solver",
            "integer decisions", "branch and bound behaviour", "optimality gap")),
        Map.entry("or_tools_highs", SpecializationBrief.of(
            "a large-scale LP and MIP expert using the HiGHS solver",
            "problem scale", "presolve reductions", "solution quality")),
        Map.entry("pulp_cbc", SpecializationBrief.of(
            "an optimization practitioner using PuLP with the CBC solver",
            "straightforward MIP modeling", "solution feasibility", "runtime expectations")),
        Map.entry("cvxpy_optimization", SpecializationBrief.of(
            "a convex optimization expert using CVXPY",
            "convexity of the formulation", "disciplined convex programming rules", "numerical stability")),
        Map.entry("solution_validation", SpecializationBrief.of(
            "a solution validation specialist",
            "constraint satisfaction of the proposed solution", "objective sanity checks", "infeasibility diagnosis"))
    );

    private static final Map<TaskType, SpecializationBrief> FALLBACKS = new EnumMap<>(Map.of(
        TaskType.INTENT_CLASSIFICATION, SpecializationBrief.of(
            "a manufacturing optimization analyst", "the primary decision the query asks for"),
        TaskType.DATA_ANALYSIS, SpecializationBrief.of(
            "a data analyst for optimization models", "data entities the model will need"),
        TaskType.MODEL_BUILDING, SpecializationBrief.of(
            "an optimization modeler", "a correct and tractable formulation"),
        TaskType.SOLUTION_SOLVING, SpecializationBrief.of(
            "an optimization solver specialist", "solving the model and reporting the result")
    ));

    private final ObjectWriter payloadWriter;

    public PromptFactory(ObjectMapper objectMapper) {
        this.payloadWriter = objectMapper.writer()
            .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .withDefaultPrettyPrinter();
    }

    public String build(SwarmAgent agent, Task task) {
        SpecializationBrief brief = briefFor(agent.specialization(), task.taskType());
        ResponseSchema schema = ResponseSchema.forTaskType(task.taskType());

        StringBuilder prompt = new StringBuilder()
            .append("You are ").append(brief.expertise()).append(".\n")
            .append("Task: ").append(task.taskType().wireName()).append("\n\n")
            .append("INPUT:\n").append(renderPayload(task.payload())).append("\n\n")
            .append("FOCUS ON:\n");
        for (int i = 0; i < brief.focus().size(); i++) {
            prompt.append(i + 1).append(". ").append(brief.focus().get(i)).append('\n');
        }
        return prompt
            .append("\nRespond ONLY with a JSON object in exactly this format, no other text:\n")
            .append(schema.template())
            .toString();
    }

    static SpecializationBrief briefFor(String specialization, TaskType taskType) {
        SpecializationBrief brief = BRIEFS.get(specialization);
        return brief != null ? brief : FALLBACKS.get(taskType);
    }

    private String renderPayload(Map<String, Object> payload) {
        try {
            return payloadWriter.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Task payload is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
