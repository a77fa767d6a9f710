package com.example.comicshelf.infrastructure.persistence.mapper;

import com.example.comicshelf.infrastructure.persistence.entity.TagModificationEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface TagModificationMapper {

    @Select("SELECT source_norm, action, target_norm, display_name, created_at, updated_at "
            + "FROM tag_modification ORDER BY source_norm")
    List<TagModificationEntity> selectAll();

    @Insert("INSERT INTO tag_modification(source_norm, action, target_norm, display_name) "
            + "VALUES(#{sourceNorm}, #{action}, #{targetNorm}, #{displayName}) "
            + "ON DUPLICATE KEY UPDATE action = VALUES(action), target_norm = VALUES(target_norm), "
            + "display_name = VALUES(display_name), updated_at = NOW()")
    int upsert(TagModificationEntity entity);

    @Delete("DELETE FROM tag_modification WHERE source_norm = #{sourceNorm}")
    int deleteBySource(@Param("sourceNorm") String sourceNorm);
}
