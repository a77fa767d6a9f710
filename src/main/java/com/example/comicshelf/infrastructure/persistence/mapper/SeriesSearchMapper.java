package com.example.comicshelf.infrastructure.persistence.mapper;

import com.example.comicshelf.infrastructure.persistence.entity.SeriesEntity;
import java.util.Collection;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

/**
 * Maintains and queries the series_search full-text table. Statements live in SeriesSearchMapper.xml.
 */
@Mapper
public interface SeriesSearchMapper {

    int upsertDocuments(@Param("seriesIds") Collection<Long> seriesIds);

    int upsertDocumentsByNames(@Param("names") Collection<String> names);

    int rebuildAll();

    @Delete("DELETE FROM series_search WHERE series_id = #{seriesId}")
    int deleteDocument(@Param("seriesId") Long seriesId);

    @Delete("DELETE FROM series_search")
    int deleteAll();

    @Select("SELECT COUNT(1) FROM series_search")
    long countDocuments();

    List<SeriesEntity> searchFullText(@Param("query") String query, @Param("limit") int limit);

    List<SeriesEntity> searchLike(@Param("pattern") String pattern, @Param("limit") int limit);
}
