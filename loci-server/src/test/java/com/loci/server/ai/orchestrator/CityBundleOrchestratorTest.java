package com.loci.server.ai.orchestrator;

import com.loci.common.exception.BaseException;
import com.loci.common.exception.GenerationException;
import com.loci.common.properties.ChatProperties;
import com.loci.common.result.ErrorCode;
import com.loci.pojo.ai.GeneralCityData;
import com.loci.pojo.ai.PoiDetailedInfo;
import com.loci.pojo.dto.CityBundleRequestDTO;
import com.loci.pojo.vo.CityBundleVO;
import com.loci.server.service.CityBundlePersistenceService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * 三路生成互不影响：一路失败只出现在 errors 中，全部失败才抛异常。
 */
@ExtendWith(MockitoExtension.class)
class CityBundleOrchestratorTest {

    @Mock
    private GenerationWorkers generationWorkers;

    @Mock
    private CityBundlePersistenceService cityBundlePersistenceService;

    private ExecutorService executor;

    private CityBundleOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
        ChatProperties properties = new ChatProperties();
        properties.setWorkerTimeoutSeconds(5);
        orchestrator = new CityBundleOrchestrator(generationWorkers,
                new ParallelGenerationRunner(executor, properties), cityBundlePersistenceService);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void personalizedFailureShouldNotHideGeneralPois() throws Exception {
        GenerationResult city = GenerationResult.success(GenerationTask.CITY_DATA);
        GeneralCityData cityData = new GeneralCityData();
        cityData.setCity("Lisbon");
        city.setCityData(cityData);
        GenerationResult general = GenerationResult.success(GenerationTask.GENERAL_POIS);
        general.setPois(List.of(poi("Belem Tower"), poi("Alfama")));
        when(generationWorkers.cityData("Lisbon")).thenReturn(city);
        when(generationWorkers.generalPois("Lisbon")).thenReturn(general);
        when(generationWorkers.personalizedPois(any(CityBundleRequestDTO.class), eq(true)))
                .thenReturn(GenerationResult.failure(GenerationTask.PERSONALIZED_POIS, "quota exceeded"));

        CityBundleVO bundle = orchestrator.generateAndPersist(request(" Lisbon "));

        assertEquals("Lisbon", bundle.getCityName());
        assertEquals(2, bundle.getGeneralPois().size());
        assertEquals("Lisbon", bundle.getCityData().getCity());
        assertEquals(1, bundle.getErrors().size());
        assertEquals("quota exceeded", bundle.getErrors().get("personalized_pois"));
        assertTrue(bundle.getPersonalizedPois().isEmpty());
        verify(cityBundlePersistenceService).persist(any(CityBundleRequestDTO.class), same(bundle));
    }

    @Test
    void allFailuresShouldRaiseGenerationException() throws Exception {
        when(generationWorkers.cityData("Lisbon"))
                .thenReturn(GenerationResult.failure(GenerationTask.CITY_DATA, "a"));
        when(generationWorkers.generalPois("Lisbon"))
                .thenReturn(GenerationResult.failure(GenerationTask.GENERAL_POIS, "b"));
        when(generationWorkers.personalizedPois(any(CityBundleRequestDTO.class), eq(true)))
                .thenReturn(GenerationResult.failure(GenerationTask.PERSONALIZED_POIS, "c"));

        GenerationException ex = assertThrows(GenerationException.class,
                () -> orchestrator.generateAndPersist(request("Lisbon")));

        assertEquals(ErrorCode.AI_ALL_TASKS_FAILED.getCode(), ex.getCode().intValue());
        assertTrue(ex.getMessage().contains("general_pois: b"));
        verifyNoInteractions(cityBundlePersistenceService);
    }

    @Test
    void persistFlagFalseShouldSkipStorage() throws Exception {
        GenerationResult personalized = GenerationResult.success(GenerationTask.PERSONALIZED_POIS);
        personalized.setLlmInteractionId(12L);
        when(generationWorkers.cityData("Lisbon"))
                .thenReturn(GenerationResult.failure(GenerationTask.CITY_DATA, "a"));
        when(generationWorkers.generalPois("Lisbon"))
                .thenReturn(GenerationResult.failure(GenerationTask.GENERAL_POIS, "b"));
        when(generationWorkers.personalizedPois(any(CityBundleRequestDTO.class), eq(true))).thenReturn(personalized);
        CityBundleRequestDTO request = request("Lisbon");
        request.setPersist(Boolean.FALSE);

        CityBundleVO bundle = orchestrator.generateAndPersist(request);

        assertEquals(12L, bundle.getLlmInteractionId());
        verifyNoInteractions(cityBundlePersistenceService);
    }

    @Test
    void blankCityShouldBeRejectedBeforeAnyWork() {
        BaseException ex = assertThrows(BaseException.class, () -> orchestrator.generate(request("  ")));

        assertEquals(ErrorCode.INVALID_PARAM.getCode(), ex.getCode().intValue());
        verifyNoInteractions(generationWorkers);
    }

    private static CityBundleRequestDTO request(String cityName) {
        CityBundleRequestDTO request = new CityBundleRequestDTO();
        request.setCityName(cityName);
        return request;
    }

    private static PoiDetailedInfo poi(String name) {
        PoiDetailedInfo poi = new PoiDetailedInfo();
        poi.setName(name);
        return poi;
    }
}
