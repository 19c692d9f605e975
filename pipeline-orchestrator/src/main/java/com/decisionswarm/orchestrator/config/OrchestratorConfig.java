package com.decisionswarm.orchestrator.config;

import com.decisionswarm.common.model.Stage;
import com.decisionswarm.swarm.llm.InferenceProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Bean
    public PipelineConfig defaultPipelineConfig(SwarmProperties swarmProperties,
                                                InferenceProperties inferenceProperties) {
        PipelineConfig config = PipelineConfig.from(swarmProperties);

        Duration worstAgent = config.agentTimeout().multipliedBy(2).plus(inferenceProperties.getRetryBackoff());
        if (config.stageTimeout().compareTo(worstAgent) < 0) {
            log.warn("[Config] stage-timeout {} is shorter than an agent's worst case {} (two attempts + backoff); "
                + "retried agents may be cut off by the stage deadline", config.stageTimeout(), worstAgent);
        }
        if (!inferenceProperties.hasApiKey()) {
            log.warn("[Config] swarm.inference.api-key is not set; inference calls will be rejected");
        }
        log.info("[Config] pipeline agentTimeout={} stageTimeout={} quorum={} swarmSizes=[{}, {}, {}, {}]",
            config.agentTimeout(), config.stageTimeout(), config.minQuorum(),
            config.roster().get(Stage.INTENT).size(),
            config.roster().get(Stage.DATA).size(),
            config.roster().get(Stage.MODEL).size(),
            config.roster().get(Stage.SOLVER).size());
        return config;
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
