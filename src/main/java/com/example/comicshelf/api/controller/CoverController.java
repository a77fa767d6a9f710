package com.example.comicshelf.api.controller;

import com.example.comicshelf.application.service.CoverThumbnailService;
import com.example.comicshelf.common.exception.BusinessException;
import com.example.comicshelf.domain.model.CoverImage;
import java.io.IOException;
import javax.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/comics")
public class CoverController {

    private static final Logger log = LoggerFactory.getLogger(CoverController.class);

    private final CoverThumbnailService coverThumbnailService;

    public CoverController(CoverThumbnailService coverThumbnailService) {
        this.coverThumbnailService = coverThumbnailService;
    }

    @GetMapping("/{id}/thumbnail")
    public void thumbnail(@PathVariable("id") String id, HttpServletResponse response) throws IOException {
        CoverImage cover;
        try {
            cover = coverThumbnailService.getCover(id);
        } catch (BusinessException e) {
            writeError(response, e);
            return;
        }
        response.setContentType(cover.getContentType());
        response.setContentLength(cover.getBytes().length);
        // placeholders must not be cached, the real cover replaces them shortly
        response.setHeader("Cache-Control", cover.isPlaceholder() ? "no-store" : "public, max-age=86400");
        response.getOutputStream().write(cover.getBytes());
    }

    private void writeError(HttpServletResponse response, BusinessException e) throws IOException {
        if (response.isCommitted()) {
            log.warn("COVER_ERROR_AFTER_COMMIT code={} msg={}", e.getCode(), e.getMessage());
            return;
        }
        response.resetBuffer();
        response.sendError(resolveHttpStatus(e.getCode()), e.getMessage());
    }

    private int resolveHttpStatus(String code) {
        try {
            int status = Integer.parseInt(code);
            return status >= 400 && status <= 599 ? status : HttpServletResponse.SC_INTERNAL_SERVER_ERROR;
        } catch (NumberFormatException e) {
            return HttpServletResponse.SC_INTERNAL_SERVER_ERROR;
        }
    }
}
