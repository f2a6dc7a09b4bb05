package com.rectify.API;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rectify.API.dto.CornerPoint;
import com.rectify.API.dto.RectifyRequest;
import com.rectify.imageOperation.ImageCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
public class RectifyControllerTest {

    private static final List<CornerPoint> POSTCARD = Arrays.asList(
            new CornerPoint(50.0, 60.0), new CornerPoint(350.0, 40.0),
            new CornerPoint(360.0, 280.0), new CornerPoint(40.0, 260.0));

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ImageCodec imageCodec;

    private String sourceBase64;

    @BeforeEach
    public void setUp() {
        byte[] jpeg = imageCodec.encodeJpeg(RectifyServiceTest.postcardImage(400, 300), 90);
        sourceBase64 = Base64.getEncoder().encodeToString(jpeg);
    }

    @Test
    public void returnsRectifiedJpeg() throws Exception {
        mockMvc.perform(post("/api/rectify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new RectifyRequest(sourceBase64, POSTCARD, 400, 300))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.width").value(321))
                .andExpect(jsonPath("$.height").value(240))
                .andExpect(jsonPath("$.imageBase64").isString());
    }

    @Test
    public void missingImageIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/rectify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new RectifyRequest(null, POSTCARD, null, null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("imageBase64")));
    }

    @Test
    public void threeCornersIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/rectify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new RectifyRequest(sourceBase64, POSTCARD.subList(0, 3), null, null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("got 3")));
    }

    @Test
    public void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/rectify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"imageBase64\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    public void nonJsonContentTypeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/rectify")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("application/json")));
    }

    @Test
    public void missingContentTypeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/rectify").content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    public void undecodableImageIsServerError() throws Exception {
        String text = Base64.getEncoder().encodeToString("hello postcard".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(post("/api/rectify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new RectifyRequest(text, POSTCARD, null, null))))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value(containsString("decoded")));
    }

    @Test
    public void collinearCornersAreServerError() throws Exception {
        List<CornerPoint> corners = Arrays.asList(
                new CornerPoint(0.0, 0.0), new CornerPoint(100.0, 0.0),
                new CornerPoint(200.0, 0.0), new CornerPoint(0.0, 100.0));

        mockMvc.perform(post("/api/rectify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new RectifyRequest(sourceBase64, corners, null, null))))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value(containsString("collinear")));
    }

    private String json(RectifyRequest request) throws Exception {
        return objectMapper.writeValueAsString(request);
    }
}
