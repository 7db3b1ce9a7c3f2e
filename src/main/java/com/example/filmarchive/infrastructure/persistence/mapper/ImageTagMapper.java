package com.example.filmarchive.infrastructure.persistence.mapper;

import com.example.filmarchive.infrastructure.persistence.entity.ImageTagEntity;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface ImageTagMapper {

    @Insert("INSERT INTO image_tags (image_id, tag, source, confidence, category, created_at) "
            + "VALUES (#{imageId}, #{tag}, #{source}, #{confidence}, #{category}, #{createdAt})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    void insert(ImageTagEntity entity);

    @Select("SELECT COUNT(1) FROM image_tags WHERE image_id = #{imageId} AND source = #{source}")
    int countByImageAndSource(@Param("imageId") Long imageId, @Param("source") String source);

    @Delete("DELETE FROM image_tags WHERE image_id = #{imageId}")
    int deleteByImageId(@Param("imageId") Long imageId);
}
