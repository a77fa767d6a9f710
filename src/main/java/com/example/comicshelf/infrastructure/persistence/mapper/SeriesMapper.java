package com.example.comicshelf.infrastructure.persistence.mapper;

import com.example.comicshelf.infrastructure.persistence.entity.SeriesEntity;
import com.example.comicshelf.infrastructure.persistence.model.NsfwFlagUpdate;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface SeriesMapper {

    String COLUMNS = "id, name, title, title_english, title_japanese, synonyms, authors, synopsis, genres, tags, "
            + "demographics, status, total_volumes, total_chapters, release_year, mal_id, anilist_id, "
            + "cover_comic_id, category, subcategory, is_adult, is_nsfw, nsfw_override, created_at, updated_at";

    /**
     * Insert by unique name, or coalesce non-null fields into the existing row. Defined in SeriesMapper.xml.
     */
    int upsert(SeriesEntity series);

    @Select("SELECT " + COLUMNS + " FROM series WHERE id = #{id}")
    SeriesEntity selectById(@Param("id") Long id);

    @Select("SELECT " + COLUMNS + " FROM series WHERE name = #{name}")
    SeriesEntity selectByName(@Param("name") String name);

    @Select("SELECT id FROM series WHERE name = #{name}")
    Long selectIdByName(@Param("name") String name);

    @Select("SELECT id, name, title, synopsis, genres, tags, demographics, cover_comic_id, total_chapters FROM series")
    List<SeriesEntity> selectTagSources();

    @Select("SELECT id, category, subcategory, genres, tags, demographics, is_adult, is_nsfw, nsfw_override "
            + "FROM series")
    List<SeriesEntity> selectNsfwSources();

    /**
     * Single multi-row flag update, defined in SeriesMapper.xml.
     */
    int batchUpdateNsfw(@Param("list") List<NsfwFlagUpdate> updates);

    @Update("UPDATE series SET nsfw_override = #{override}, updated_at = NOW() WHERE id = #{id}")
    int updateNsfwOverride(@Param("id") Long id, @Param("override") Integer override);

    @Update("UPDATE series SET name = #{name}, updated_at = NOW() WHERE id = #{id}")
    int updateName(@Param("id") Long id, @Param("name") String name);

    /**
     * Fills gaps in the target from the source before the source is dropped. Defined in SeriesMapper.xml.
     */
    int mergeInto(@Param("sourceId") Long sourceId, @Param("targetId") Long targetId);

    @Delete("DELETE FROM series WHERE id = #{id}")
    int deleteById(@Param("id") Long id);

    @Delete("DELETE FROM series")
    int deleteAll();
}
