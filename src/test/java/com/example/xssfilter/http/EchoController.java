package com.example.xssfilter.http;

import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Test-only endpoints that echo what the handler received after filtering.
 */
@RestController
class EchoController {

    @PostMapping(value = "/echo/raw", produces = MediaType.TEXT_PLAIN_VALUE)
    String raw(@RequestBody byte[] body) {
        return new String(body, StandardCharsets.UTF_8);
    }

    @PostMapping(value = "/echo/form", produces = MediaType.TEXT_PLAIN_VALUE)
    String form(@RequestParam("name") String name, @RequestParam("password") String password) {
        return name + "|" + password;
    }

    @GetMapping(value = "/echo/query", produces = MediaType.TEXT_PLAIN_VALUE)
    String query(HttpServletRequest request, @RequestParam("q") List<String> q) {
        return request.getQueryString() + "|" + String.join(",", q);
    }

    @PostMapping(value = "/echo/multipart", produces = MediaType.TEXT_PLAIN_VALUE)
    String multipart(@RequestParam("bio") String bio, @RequestParam("upload") MultipartFile upload)
            throws IOException {
        return bio + "|" + upload.getOriginalFilename() + "|" + new String(upload.getBytes(), StandardCharsets.UTF_8);
    }

    @GetMapping(value = "/payload", produces = MediaType.APPLICATION_JSON_VALUE)
    Map<String, Object> payload() {
        return Map.of("message", "<script>alert(1)</script>hi");
    }

    @GetMapping(value = "/payload/plain", produces = MediaType.TEXT_PLAIN_VALUE)
    String plain() {
        return "<b>kept</b>";
    }

    @GetMapping("/payload/broken")
    ResponseEntity<String> broken() {
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body("{oops");
    }
}
