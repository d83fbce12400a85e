package com.loci.server.service;

import com.loci.pojo.dto.CityBundleRequestDTO;
import com.loci.pojo.vo.CityBundleVO;

/**
 * 三路生成结果落库：城市、通用 POI、个性化 POI + 行程 + 距离排序。
 */
public interface CityBundlePersistenceService {

    void persist(CityBundleRequestDTO request, CityBundleVO bundle);
}
