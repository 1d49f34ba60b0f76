package com.biography.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.biography.domain.entity.BiographyRecord;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

@Mapper
public interface BiographyRepository extends BaseMapper<BiographyRecord> {

    @Select("SELECT * FROM biographies WHERE id = #{id} AND user_id = #{userId}")
    BiographyRecord findByIdAndUserId(@Param("id") String id, @Param("userId") String userId);

    @Select("SELECT * FROM biographies WHERE user_id = #{userId} AND lorebook_name = #{lorebookName} ORDER BY created_time DESC")
    List<BiographyRecord> findByLorebookName(@Param("userId") String userId, @Param("lorebookName") String lorebookName);

    @Select("SELECT * FROM biographies WHERE user_id = #{userId} AND (id = #{baseId} OR base_biography_id = #{baseId}) ORDER BY created_time ASC")
    List<BiographyRecord> findVersionFamily(@Param("userId") String userId, @Param("baseId") String baseId);

    @Update("UPDATE biographies SET base_biography_id = #{baseId} WHERE id = #{versionId}")
    int linkToBase(@Param("versionId") String versionId, @Param("baseId") String baseId);
}
