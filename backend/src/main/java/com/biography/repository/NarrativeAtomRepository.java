package com.biography.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.biography.domain.entity.NarrativeAtomRecord;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface NarrativeAtomRepository extends BaseMapper<NarrativeAtomRecord> {

    @Select("SELECT * FROM narrative_atoms WHERE user_id = #{userId} ORDER BY occurred_at ASC, id ASC")
    List<NarrativeAtomRecord> findByUserId(@Param("userId") String userId);
}
