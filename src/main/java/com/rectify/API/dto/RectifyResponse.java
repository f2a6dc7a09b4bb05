package com.rectify.API.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class RectifyResponse {
    private final String imageBase64;
    private final int width;
    private final int height;
}
