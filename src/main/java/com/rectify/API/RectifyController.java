package com.rectify.API;

import com.rectify.API.dto.RectifyRequest;
import com.rectify.API.dto.RectifyResponse;
import com.rectify.error.InvalidInputException;
import com.rectify.error.RectificationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class RectifyController {

    private final RectifyService rectifyService;

    @PostMapping(value = "/rectify", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> rectify(@RequestBody(required = false) RectifyRequest request) {
        try {
            if (request == null) {
                return ResponseEntity.badRequest().body(error("Request body is required"));
            }
            RectifyResponse response = rectifyService.rectify(request);
            return ResponseEntity.ok().body(response);

        } catch (InvalidInputException e) {
            log.warn("Rejected rectify request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(error(e.getMessage()));

        } catch (RectificationException e) {
            log.error("Rectification failed ({}): {}", e.getClass().getSimpleName(), e.getMessage());
            return ResponseEntity.internalServerError().body(error(e.getMessage()));

        } catch (Exception e) {
            log.error("Unexpected rectification failure", e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ResponseEntity.internalServerError().body(error(message));
        }
    }

    static Map<String, String> error(String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        return error;
    }
}
