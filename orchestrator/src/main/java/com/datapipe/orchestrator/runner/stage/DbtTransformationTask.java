package com.datapipe.orchestrator.runner.stage;

import com.datapipe.orchestrator.config.OrchestratorProperties;
import com.datapipe.orchestrator.dataset.Item;
import com.datapipe.orchestrator.dataset.Tier;
import com.datapipe.orchestrator.registry.StageRegistry;
import com.datapipe.orchestrator.runner.StageExecutionContext;
import com.datapipe.orchestrator.runner.StageTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Stage 4: tier every processed record and attach the average total_value
 * of its category.
 */
@Component
public class DbtTransformationTask implements StageTask<List<Item>, List<Item>> {

    private static final Logger log = LoggerFactory.getLogger(DbtTransformationTask.class);

    static final String TRANSFORMED_BY = "dbt";

    private final OrchestratorProperties props;
    private final Clock                  clock;

    public DbtTransformationTask(OrchestratorProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    @Override
    public String stageName() {
        return StageRegistry.DBT_TRANSFORMATION;
    }

    @Override
    public List<Item> execute(List<Item> input, StageExecutionContext ctx) throws Exception {
        log.info("Transforming {} records", input.size());
        String transformedAt = LocalDateTime.now(clock).toString();

        for (Item item : input) {
            if (item.totalValue() == null) {
                throw new IllegalStateException("Record " + item.id() + " has no total_value");
            }
        }
        Map<String, Double> categoryAvg = input.stream()
                .collect(Collectors.groupingBy(Item::category, Collectors.averagingDouble(Item::totalValue)));

        List<Item> transformed = input.stream()
                .map(item -> {
                    Tier tier = Tier.of(item.totalValue());
                    return item.withTransformation(tier == Tier.PREMIUM, tier, TRANSFORMED_BY, transformedAt)
                            .withCategoryAvgValue(categoryAvg.get(item.category()));
                })
                .toList();

        SimulatedWork.pause(props.simulatedDelay());
        log.info("Transformed {} records across {} categories", transformed.size(), categoryAvg.size());
        return transformed;
    }

    @Override
    public Long recordsProcessed(List<Item> output) {
        return (long) output.size();
    }
}
