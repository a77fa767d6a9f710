package com.example.comicshelf.infrastructure.persistence.mapper;

import com.example.comicshelf.infrastructure.persistence.entity.ComicEntity;
import com.example.comicshelf.infrastructure.persistence.model.ComicFingerprint;
import com.example.comicshelf.infrastructure.persistence.model.ComicNumberingRow;
import com.example.comicshelf.infrastructure.persistence.model.ComicProcessingUpdate;
import com.example.comicshelf.infrastructure.persistence.model.FanComicRow;
import java.util.Collection;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface ComicMapper {

    String COLUMNS = "id, path, filename, series, series_id, category, subcategory, size_bytes, mtime, pages, "
            + "processed, has_thumbnail, thumbnail_format, file_hash, volume, chapter, created_at, updated_at";

    @Select("SELECT id, mtime, size_bytes FROM comic")
    List<ComicFingerprint> selectFingerprints();

    @Select("SELECT " + COLUMNS + " FROM comic WHERE id = #{id}")
    ComicEntity selectById(@Param("id") String id);

    /**
     * Multi-row insert, defined in ComicMapper.xml.
     */
    int batchInsert(@Param("list") List<ComicEntity> comics);

    @Update("UPDATE comic SET path = #{path}, filename = #{filename}, series = #{series}, series_id = NULL, "
            + "category = #{category}, subcategory = #{subcategory}, size_bytes = #{sizeBytes}, mtime = #{mtime}, "
            + "volume = #{volume}, chapter = #{chapter}, pages = NULL, processed = 0, has_thumbnail = 0, "
            + "file_hash = NULL, hash_failed = 0, updated_at = NOW() WHERE id = #{id}")
    int updateChanged(ComicEntity comic);

    @Delete("<script>"
            + "DELETE FROM comic WHERE id IN "
            + "<foreach collection='ids' item='id' open='(' separator=',' close=')'>#{id}</foreach>"
            + "</script>")
    int deleteByIds(@Param("ids") Collection<String> ids);

    @Delete("DELETE FROM comic")
    int deleteAll();

    @Update("UPDATE comic c JOIN series s ON s.name = c.series SET c.series_id = s.id "
            + "WHERE c.series_id IS NULL OR c.series_id <> s.id")
    int linkSeriesIds();

    @Select("SELECT " + COLUMNS + " FROM comic WHERE processed = 0 ORDER BY id LIMIT #{limit}")
    List<ComicEntity> selectPending(@Param("limit") int limit);

    @Select("SELECT COUNT(1) FROM comic WHERE processed = 0")
    int countPending();

    @Select("SELECT COUNT(1) FROM comic")
    int countAll();

    /**
     * Re-queues comics that were marked processed without a usable page count.
     */
    @Update("UPDATE comic SET processed = 0 WHERE processed = 1 AND (pages IS NULL OR pages = 0)")
    int resetEmptyProcessed();

    /**
     * Applies one processing round in a single statement, defined in ComicMapper.xml.
     */
    int batchUpdateProcessing(@Param("list") List<ComicProcessingUpdate> updates);

    @Update("UPDATE comic SET has_thumbnail = 1, thumbnail_format = #{format}, updated_at = NOW() WHERE id = #{id}")
    int markThumbnail(@Param("id") String id, @Param("format") String format);

    @Update("UPDATE comic SET series_id = #{targetId}, series = #{targetName}, updated_at = NOW() "
            + "WHERE series_id = #{sourceId} OR series = #{sourceName}")
    int repointSeries(@Param("sourceId") Long sourceId,
                      @Param("sourceName") String sourceName,
                      @Param("targetId") Long targetId,
                      @Param("targetName") String targetName);

    /**
     * Up to {@code perSeries} comics per series, defined in ComicMapper.xml.
     */
    List<FanComicRow> selectFanComics(@Param("seriesIds") Collection<Long> seriesIds,
                                      @Param("perSeries") int perSeries);

    /**
     * Comics still waiting for a content hash. Rows whose file could not be read are left out until
     * a sync sees the file change.
     */
    @Select("SELECT " + COLUMNS + " FROM comic WHERE file_hash IS NULL AND hash_failed = 0 "
            + "ORDER BY id LIMIT #{limit}")
    List<ComicEntity> selectWithoutHash(@Param("limit") int limit);

    @Update("UPDATE comic SET file_hash = #{fileHash}, hash_failed = 0 WHERE id = #{id}")
    int updateFileHash(@Param("id") String id, @Param("fileHash") String fileHash);

    @Update("UPDATE comic SET hash_failed = 1 WHERE id = #{id}")
    int markHashFailed(@Param("id") String id);

    @Select("SELECT " + COLUMNS + " FROM comic WHERE file_hash IN ("
            + "SELECT h.file_hash FROM (SELECT file_hash FROM comic WHERE file_hash IS NOT NULL "
            + "GROUP BY file_hash HAVING COUNT(1) > 1) h) ORDER BY file_hash, path")
    List<ComicEntity> selectDuplicateHashMembers();

    @Select("SELECT series, volume, chapter FROM comic WHERE series IS NOT NULL ORDER BY series, volume, chapter")
    List<ComicNumberingRow> selectNumbering();
}
