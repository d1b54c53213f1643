package com.aim.scraper.controller;

import com.aim.scraper.dto.ModelRunRequest;
import com.aim.scraper.model.ParsedResult;
import com.aim.scraper.model.ResultRow;
import com.aim.scraper.service.core.ModelRunService;
import com.aim.scraper.service.http.NetworkException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller running the AIM model on behalf of a client UI.
 * <p>
 * Endpoints:
 * <ul>
 *   <li><code>POST /api/aim/run</code> returns the parsed result as JSON,</li>
 *   <li><code>POST /api/aim/run/export</code> returns the same result as a
 *       two-column CSV attachment.</li>
 * </ul>
 *
 * <h3>Example Request</h3>
 * <pre>{@code
 * POST /api/aim/run
 * Content-Type: application/json
 *
 * {
 *   "temperatureK": 298.15,
 *   "relativeHumidity": 0.5,
 *   "species": { "H+": 0.2, "NH4+": 0.0, "SO42-": 0.1, "NO3-": 0.0 },
 *   "solids": ["(NH4)2SO4", "Ice"]
 * }
 * }</pre>
 *
 * <h3>Error Handling</h3>
 * <ul>
 *   <li>400 BAD REQUEST: invalid inputs</li>
 *   <li>502 BAD GATEWAY: the model page could not be reached or rejected the request;
 *       safe to retry</li>
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("/api/aim/run")
@RequiredArgsConstructor
public class ModelRunController {

    static final String EXPORT_FILENAME = "aim_results.csv";

    private final ModelRunService modelRunService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ParsedResult run(@Valid @RequestBody final ModelRunRequest request) {
        return modelRunService.run(request.toParameters(), request.timeout());
    }

    @PostMapping(path = "/export", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> export(@Valid @RequestBody final ModelRunRequest request) {
        ParsedResult result = modelRunService.run(request.toParameters(), request.timeout());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + EXPORT_FILENAME)
                .contentType(new MediaType("text", "csv"))
                .body(CsvUtil.fromRows(result.toRows()));
    }

    @ExceptionHandler(NetworkException.class)
    public ResponseEntity<Map<String, String>> handleNetwork(final NetworkException ex) {
        log.warn("Model page unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(final IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", ex.getMessage()));
    }

    static final class CsvUtil {

        private CsvUtil() {
        }

        static String fromRows(final List<ResultRow> rows) {
            StringBuilder sb = new StringBuilder("parameter,value\n");
            for (ResultRow row : rows) {
                sb.append(escape(row.parameter())).append(',')
                        .append(escape(row.value())).append('\n');
            }
            return sb.toString();
        }

        /** Quotes only when needed, doubling embedded quotes. */
        static String escape(final String s) {
            if (s == null) {
                return "";
            }
            if (s.contains(",") || s.contains("\"") || s.contains("\n") || s.contains("\r")) {
                return "\"" + s.replace("\"", "\"\"") + "\"";
            }
            return s;
        }
    }
}
