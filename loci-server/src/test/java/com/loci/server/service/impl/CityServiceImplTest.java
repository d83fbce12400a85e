package com.loci.server.service.impl;

import com.loci.pojo.ai.GeneralCityData;
import com.loci.pojo.entity.City;
import com.loci.server.mapper.CityMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CityServiceImplTest {

    @Mock
    private CityMapper cityMapper;

    private CityServiceImpl cityService;

    @BeforeEach
    void setUp() {
        cityService = new CityServiceImpl();
        ReflectionTestUtils.setField(cityService, "baseMapper", cityMapper);
    }

    @Test
    void findIdByName_shouldPassNameThroughUnchanged() {
        when(cityMapper.findIdByName("Lisbon")).thenReturn(3L);
        when(cityMapper.findIdByName("lisbon")).thenReturn(null);

        assertEquals(3L, cityService.findIdByName("Lisbon"));
        // 精确匹配，不做大小写归一
        assertNull(cityService.findIdByName("lisbon"));
        assertNull(cityService.findIdByName(" "));
        verify(cityMapper, never()).findIdByName(" ");
    }

    @Test
    void findOrCreate_shouldReuseExistingCity() {
        City existing = new City();
        existing.setId(3L);
        when(cityMapper.findByNameAndCountry("Lisbon", "Portugal")).thenReturn(existing);

        assertSame(existing, cityService.findOrCreate(cityData()));
        verify(cityMapper, never()).insert(any(City.class));
    }

    @Test
    void findOrCreate_shouldInsertFromAiCityData() {
        when(cityMapper.findByNameAndCountry("Lisbon", "Portugal")).thenReturn(null);

        City created = cityService.findOrCreate(cityData());

        ArgumentCaptor<City> captor = ArgumentCaptor.forClass(City.class);
        verify(cityMapper).insert(captor.capture());
        assertSame(created, captor.getValue());
        assertEquals("Lisbon", created.getName());
        assertEquals("Capital by the Tagus", created.getAiSummary());
        assertEquals(38.7223, created.getCenterLatitude());
        assertNotNull(created.getCreatedAt());
    }

    @Test
    void findOrCreate_shouldIgnoreIncompleteData() {
        assertNull(cityService.findOrCreate(null));
        assertNull(cityService.findOrCreate(new GeneralCityData()));
        verifyNoInteractions(cityMapper);
    }

    private static GeneralCityData cityData() {
        GeneralCityData data = new GeneralCityData();
        data.setCity("Lisbon");
        data.setCountry("Portugal");
        data.setDescription("Capital by the Tagus");
        data.setCenterLatitude(38.7223);
        data.setCenterLongitude(-9.1393);
        return data;
    }
}
