package com.datapipe.orchestrator.service;

import com.datapipe.orchestrator.model.Pipeline;
import com.datapipe.orchestrator.model.RunStatus;
import com.datapipe.orchestrator.model.Stage;
import com.datapipe.orchestrator.registry.StageRegistry;
import com.datapipe.orchestrator.repository.OffsetPageRequest;
import com.datapipe.orchestrator.repository.PipelineRepository;
import com.datapipe.orchestrator.repository.StageRepository;
import com.datapipe.orchestrator.support.MutableClock;
import com.datapipe.orchestrator.support.TestEntities;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PipelineStore. Repositories are mocked; the H2-backed
 * behaviour is covered by PipelinePersistenceTest.
 */
@ExtendWith(MockitoExtension.class)
class PipelineStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Mock PipelineRepository pipelineRepo;
    @Mock StageRepository    stageRepo;

    MutableClock  clock;
    PipelineStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new PipelineStore(pipelineRepo, stageRepo, StageRegistry.defaultRegistry(), clock);
    }

    // ------------------------------------------------------------------
    // createPipeline()
    // ------------------------------------------------------------------

    @Test
    void createPipeline_insertsOnePendingStagePerRegistryEntry() {
        when(pipelineRepo.save(any())).thenAnswer(inv -> {
            Pipeline p = inv.getArgument(0);
            TestEntities.setId(p, 7L);
            return p;
        });
        when(stageRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));

        Pipeline created = store.createPipeline("  nightly ", "desc");

        assertThat(created.getName()).isEqualTo("nightly");
        assertThat(created.getStatus()).isEqualTo(RunStatus.PENDING);
        assertThat(created.getCreatedAt()).isEqualTo(T0);

        ArgumentCaptor<Stage> stages = ArgumentCaptor.forClass(Stage.class);
        verify(stageRepo, times(5)).save(stages.capture());
        assertThat(stages.getAllValues())
                .extracting(Stage::getName)
                .containsExactly("Data Generation", "Data Ingestion", "Spark Processing",
                        "DBT Transformation", "Data Export");
        assertThat(stages.getAllValues())
                .allSatisfy(s -> {
                    assertThat(s.getStatus()).isEqualTo(RunStatus.PENDING);
                    assertThat(s.getPipelineId()).isEqualTo(7L);
                });
        assertThat(created.getStages()).hasSize(5);
    }

    @Test
    void createPipeline_blankName_rejected() {
        assertThatThrownBy(() -> store.createPipeline(" ", null))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(pipelineRepo, stageRepo);
    }

    // ------------------------------------------------------------------
    // listPipelines()
    // ------------------------------------------------------------------

    @Test
    void listPipelines_usesOffsetAndNewestFirst() {
        when(pipelineRepo.findAllBy(any())).thenReturn(List.of());

        store.listPipelines(3, 2);

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(pipelineRepo).findAllBy(page.capture());
        assertThat(page.getValue().getOffset()).isEqualTo(3);
        assertThat(page.getValue().getPageSize()).isEqualTo(2);
        assertThat(page.getValue().getSort())
                .isEqualTo(Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id")));
        assertThat(page.getValue()).isInstanceOf(OffsetPageRequest.class);
    }

    @Test
    void listPipelines_badArguments_rejected() {
        assertThatThrownBy(() -> store.listPipelines(-1, 10)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.listPipelines(0, 0)).isInstanceOf(ValidationException.class);
    }

    // ------------------------------------------------------------------
    // updatePipeline() / updateStage() / deletePipeline()
    // ------------------------------------------------------------------

    @Test
    void updatePipeline_refreshesUpdatedAtEvenForNoOp() {
        Pipeline p = TestEntities.pipeline(1);
        when(pipelineRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(p));
        when(pipelineRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));
        clock.advance(Duration.ofMinutes(5));

        store.updatePipeline(1L, pipeline -> { });

        assertThat(p.getUpdatedAt()).isEqualTo(T0.plusSeconds(300));
    }

    @Test
    void updatePipeline_readsUnderRowLock() {
        Pipeline p = TestEntities.pipeline(1);
        when(pipelineRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(p));
        when(pipelineRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));

        store.updatePipeline(1L, pipeline -> pipeline.setOutputFile("out.json"));

        verify(pipelineRepo, never()).findById(any());
        assertThat(p.getOutputFile()).isEqualTo("out.json");
    }

    @Test
    void updatePipeline_unknownId_returnsEmpty() {
        when(pipelineRepo.findByIdForUpdate(9L)).thenReturn(Optional.empty());

        assertThat(store.updatePipeline(9L, p -> p.setName("x"))).isEmpty();
        verify(pipelineRepo, never()).save(any());
    }

    @Test
    void updateStage_locksPipelineRowBeforeStageRow() {
        Pipeline p = TestEntities.pipelineWithStages(1);
        Stage stage = p.getStages().get(0);
        when(stageRepo.findPipelineIdById(stage.getId())).thenReturn(Optional.of(1L));
        when(pipelineRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(p));
        when(stageRepo.findByIdForUpdate(stage.getId())).thenReturn(Optional.of(stage));
        when(stageRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));

        store.updateStage(stage.getId(), s -> s.setDescription("changed"));

        InOrder order = inOrder(pipelineRepo, stageRepo);
        order.verify(pipelineRepo).findByIdForUpdate(1L);
        order.verify(stageRepo).findByIdForUpdate(stage.getId());
        order.verify(stageRepo).save(stage);
        assertThat(stage.getDescription()).isEqualTo("changed");
    }

    @Test
    void updateStage_unknownId_returnsEmpty() {
        when(stageRepo.findPipelineIdById(99L)).thenReturn(Optional.empty());

        assertThat(store.updateStage(99L, s -> s.setDescription("x"))).isEmpty();
        verifyNoInteractions(pipelineRepo);
    }

    @Test
    void deletePipeline_unknownId_returnsFalse() {
        when(pipelineRepo.findById(5L)).thenReturn(Optional.empty());

        assertThat(store.deletePipeline(5L)).isFalse();
        verify(pipelineRepo, never()).delete(any());
    }

    // ------------------------------------------------------------------
    // findStageByName()
    // ------------------------------------------------------------------

    @Test
    void findStageByName_matchesCaseAndIdentifierForm() {
        Pipeline p = TestEntities.pipelineWithStages(1);
        List<Stage> stages = TestEntities.stages(p);

        assertThat(PipelineStore.findStageByName(stages, "data generation")).isPresent();
        assertThat(PipelineStore.findStageByName(stages, "data_export"))
                .map(Stage::getName).hasValue("Data Export");
        assertThat(PipelineStore.findStageByName(stages, "Nope")).isEmpty();
        assertThat(PipelineStore.findStageByName(stages, "")).isEmpty();
    }
}
