package com.loci.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.loci.pojo.entity.LlmInteraction;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface LlmInteractionMapper extends BaseMapper<LlmInteraction> {

    @Select("SELECT EXISTS(SELECT 1 FROM llm_interactions WHERE id = #{id})")
    boolean existsById(@Param("id") Long id);
}
