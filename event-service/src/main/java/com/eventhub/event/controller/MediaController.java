package com.eventhub.event.controller;

import com.eventhub.common.response.ApiResponse;
import com.eventhub.event.domain.MediaBlob;
import com.eventhub.event.dto.response.MediaResponse;
import com.eventhub.event.service.MediaAttachmentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Media", description = "Stored posters, promo videos and venue photos")
@RestController
@RequestMapping("/api/v1/media")
@RequiredArgsConstructor
public class MediaController {

    private final MediaAttachmentService mediaAttachmentService;

    @Operation(summary = "Download media", description = "Raw bytes with their stored content type")
    @GetMapping("/{ref}")
    public ResponseEntity<byte[]> getMedia(@PathVariable String ref) {
        MediaBlob blob = mediaAttachmentService.getMedia(ref);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(blob.getContentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.inline().filename(blob.getFilename()).build().toString())
                .body(blob.getContent());
    }

    @Operation(summary = "Get media descriptor")
    @GetMapping("/{ref}/descriptor")
    public ApiResponse<MediaResponse> getDescriptor(@PathVariable String ref) {
        return ApiResponse.ok(mediaAttachmentService.getDescriptor(ref));
    }
}
