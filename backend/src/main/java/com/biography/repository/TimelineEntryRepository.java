package com.biography.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.biography.domain.entity.TimelineEntryRecord;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface TimelineEntryRepository extends BaseMapper<TimelineEntryRecord> {

    @Select("SELECT * FROM timeline_entries WHERE user_id = #{userId} ORDER BY start_date ASC, id ASC")
    List<TimelineEntryRecord> findByUserId(@Param("userId") String userId);
}
