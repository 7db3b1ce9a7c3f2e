package com.example.filmarchive.infrastructure.persistence.mapper;

import com.example.filmarchive.infrastructure.persistence.entity.ImageRecordEntity;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface ImageRecordMapper {

    @Insert("INSERT INTO images("
            + "filename, original_path, archived_path, enhanced_path, width, height, file_size, status, "
            + "histogram_clip, clahe_clip, preset, face_detected, quality_score, processed_at, created_at, updated_at"
            + ") VALUES ("
            + "#{filename}, #{originalPath}, #{archivedPath}, #{enhancedPath}, #{width}, #{height}, #{fileSize}, #{status}, "
            + "#{histogramClip}, #{claheClip}, #{preset}, #{faceDetected}, #{qualityScore}, #{processedAt}, #{createdAt}, #{updatedAt}"
            + ") ON CONFLICT(filename) DO UPDATE SET "
            + "original_path = excluded.original_path, "
            + "archived_path = excluded.archived_path, "
            + "enhanced_path = excluded.enhanced_path, "
            + "width = excluded.width, "
            + "height = excluded.height, "
            + "file_size = excluded.file_size, "
            + "status = excluded.status, "
            + "histogram_clip = excluded.histogram_clip, "
            + "clahe_clip = excluded.clahe_clip, "
            + "preset = excluded.preset, "
            + "face_detected = excluded.face_detected, "
            + "quality_score = excluded.quality_score, "
            + "processed_at = excluded.processed_at, "
            + "updated_at = excluded.updated_at")
    int upsert(ImageRecordEntity entity);

    @Select("SELECT id, filename, original_path, archived_path, enhanced_path, width, height, file_size, status, "
            + "histogram_clip, clahe_clip, preset, face_detected, quality_score, processed_at, created_at, updated_at "
            + "FROM images WHERE filename = #{filename}")
    ImageRecordEntity selectByFilename(@Param("filename") String filename);

    @Delete("DELETE FROM images WHERE id = #{id}")
    int deleteById(@Param("id") Long id);
}
