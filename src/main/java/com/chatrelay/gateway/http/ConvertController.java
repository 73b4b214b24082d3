package com.chatrelay.gateway.http;

import com.chatrelay.convert.RasterToSvgConverter;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ConvertController {

    private static final MediaType SVG = MediaType.valueOf("image/svg+xml");

    private final RasterToSvgConverter converter;

    public ConvertController(RasterToSvgConverter converter) {
        this.converter = converter;
    }

    @PostMapping("/convert/svg")
    public ResponseEntity<String> toSvg(@RequestBody(required = false) ConvertBody body) {
        if (body == null || body.imageUrl() == null || body.imageUrl().isBlank()) {
            throw new IllegalArgumentException("imageUrl must not be blank");
        }
        int threshold = body.threshold() != null ? body.threshold() : RasterToSvgConverter.DEFAULT_THRESHOLD;
        var svg = converter.convert(body.imageUrl(), threshold);
        return ResponseEntity.ok().contentType(SVG).body(svg);
    }
}
