package com.rectify.API.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Body of {@code POST /api/rectify}. Corners are top-left, top-right, bottom-right, bottom-left.
 * {@code sourceWidth}/{@code sourceHeight} give the size of the image the corners were picked on,
 * when that differs from the uploaded image.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RectifyRequest {
    private String imageBase64;
    private List<CornerPoint> corners;
    private Integer sourceWidth;
    private Integer sourceHeight;
}
