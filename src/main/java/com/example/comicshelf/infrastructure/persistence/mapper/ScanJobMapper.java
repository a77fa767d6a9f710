package com.example.comicshelf.infrastructure.persistence.mapper;

import com.example.comicshelf.infrastructure.persistence.entity.ScanJobEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface ScanJobMapper {

    String COLUMNS = "id, scan_type, status, phase, current_file, total_comics, processed_comics, new_comics, "
            + "changed_comics, deleted_comics, processed_pages, page_errors, processed_thumbnails, thumbnail_errors, "
            + "thumb_bytes_written, thumb_bytes_saved, errors, error_summary, cancel_requested, started_at, completed_at";

    /**
     * running_guard is unique, so a second concurrent running row fails with a duplicate key.
     */
    @Insert("INSERT INTO scan_job(scan_type, status, running_guard, phase, started_at) "
            + "VALUES(#{scanType}, 'running', 1, #{phase}, NOW())")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insertRunning(ScanJobEntity entity);

    @Select("SELECT " + COLUMNS + " FROM scan_job WHERE id = #{id}")
    ScanJobEntity selectById(@Param("id") Long id);

    @Select("SELECT " + COLUMNS + " FROM scan_job ORDER BY id DESC LIMIT 1")
    ScanJobEntity selectLatest();

    @Select("SELECT COUNT(1) FROM scan_job WHERE status = 'running'")
    int countRunning();

    @Select("SELECT cancel_requested FROM scan_job WHERE id = #{id}")
    Integer selectCancelRequested(@Param("id") Long id);

    @Update("UPDATE scan_job SET cancel_requested = 1 WHERE status = 'running'")
    int requestCancel();

    @Update("UPDATE scan_job SET phase = #{phase}, current_file = #{currentFile}, total_comics = #{totalComics}, "
            + "processed_comics = #{processedComics}, new_comics = #{newComics}, changed_comics = #{changedComics}, "
            + "deleted_comics = #{deletedComics}, processed_pages = #{processedPages}, page_errors = #{pageErrors}, "
            + "processed_thumbnails = #{processedThumbnails}, thumbnail_errors = #{thumbnailErrors}, "
            + "thumb_bytes_written = #{thumbBytesWritten}, thumb_bytes_saved = #{thumbBytesSaved}, "
            + "errors = #{errors} WHERE id = #{id} AND status = 'running'")
    int updateProgress(ScanJobEntity entity);

    @Update("UPDATE scan_job SET status = #{status}, running_guard = NULL, completed_at = NOW(), "
            + "error_summary = #{errorSummary} WHERE id = #{id} AND status = 'running'")
    int markFinished(@Param("id") Long id,
                     @Param("status") String status,
                     @Param("errorSummary") String errorSummary);

    @Update("UPDATE scan_job SET status = 'failed', running_guard = NULL, completed_at = NOW(), "
            + "error_summary = #{errorSummary} WHERE status = 'running'")
    int markAllRunningFailed(@Param("errorSummary") String errorSummary);
}
