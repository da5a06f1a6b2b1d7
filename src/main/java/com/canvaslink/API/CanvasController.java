package com.canvaslink.API;

import com.canvaslink.canvasComposition.CanvasSnapshot;
import com.canvaslink.canvasComposition.PairFailure;
import com.canvaslink.canvasComposition.PanePair;
import com.canvaslink.canvasComposition.PaneView;
import com.canvaslink.canvasComposition.TransitionReport;
import com.canvaslink.exception.DetectorUnavailableException;
import com.canvaslink.exception.InvalidGeometryException;
import com.canvaslink.exception.PaneIndexOutOfRangeException;
import com.canvaslink.mapping.Connection;
import com.canvaslink.pane.FitGeometry;
import com.canvaslink.pane.PaneRect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class CanvasController {
    private static final Logger logger = LoggerFactory.getLogger(CanvasController.class);

    @Autowired
    private CanvasService canvasService;

    @Autowired
    private ImageCodecService imageCodecService;

    @PostMapping(value = "/feed", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> pushFrame(@RequestParam("frame") MultipartFile frame) {
        try {
            if (!imageCodecService.isValidImageFile(frame)) {
                return error(HttpStatus.BAD_REQUEST, "Invalid frame file: " + frame.getOriginalFilename());
            }
            TransitionReport report = canvasService.pushFrame(frame.getBytes());
            return ResponseEntity.ok().body(reportBody(report));
        } catch (InvalidGeometryException | IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            logger.error("Feed frame failed", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Error: " + e.getMessage());
        }
    }

    /**
     * Assigns an uploaded image to capture pane {@code index}, or the latest feed frame when no image
     * is sent.
     */
    @PostMapping("/panes/{index}/capture")
    public ResponseEntity<?> capture(
            @PathVariable("index") int index,
            @RequestParam(value = "image", required = false) MultipartFile image) {
        try {
            TransitionReport report;
            if (image == null) {
                report = canvasService.captureFromFeed(index);
            } else {
                if (!imageCodecService.isValidImageFile(image)) {
                    return error(HttpStatus.BAD_REQUEST, "Invalid image file: " + image.getOriginalFilename());
                }
                report = canvasService.capture(index, image.getBytes());
            }
            return ResponseEntity.ok().body(reportBody(report));
        } catch (PaneIndexOutOfRangeException | InvalidGeometryException | IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (IllegalStateException e) {
            return error(HttpStatus.CONFLICT, e.getMessage());
        } catch (Exception e) {
            logger.error("Capture into pane {} failed", index, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Error: " + e.getMessage());
        }
    }

    @GetMapping("/connections")
    public ResponseEntity<?> connections() {
        CanvasSnapshot snapshot = canvasService.snapshot();
        List<Map<String, Object>> pairs = new ArrayList<>();
        for (Map.Entry<PanePair, List<Connection>> entry : snapshot.getConnections().entrySet()) {
            List<Map<String, Object>> lines = new ArrayList<>();
            for (Connection c : entry.getValue()) {
                Map<String, Object> line = new LinkedHashMap<>();
                line.put("ax", c.getA().getX());
                line.put("ay", c.getA().getY());
                line.put("bx", c.getB().getX());
                line.put("by", c.getB().getY());
                line.put("reliability", c.getReliability());
                lines.add(line);
            }
            Map<String, Object> pair = new LinkedHashMap<>();
            pair.put("first", entry.getKey().getFirstId());
            pair.put("second", entry.getKey().getSecondId());
            pair.put("connections", lines);
            pairs.add(pair);
        }
        return ResponseEntity.ok().body(pairs);
    }

    @GetMapping("/panes")
    public ResponseEntity<?> panes() {
        CanvasSnapshot snapshot = canvasService.snapshot();
        List<Map<String, Object>> panes = new ArrayList<>();
        for (PaneView pane : snapshot.getPanes()) {
            Map<String, Object> body = new LinkedHashMap<>();
            PaneRect r = pane.getRect();
            body.put("id", pane.getId());
            body.put("rect", List.of(r.getX0(), r.getY0(), r.getX1(), r.getY1()));
            body.put("populated", pane.hasImage());
            FitGeometry fit = pane.getFit();
            if (fit != null) {
                Map<String, Object> fitBody = new LinkedHashMap<>();
                fitBody.put("scaledWidth", fit.getScaledWidth());
                fitBody.put("scaledHeight", fit.getScaledHeight());
                fitBody.put("offsetX", fit.pixelOffsetX());
                fitBody.put("offsetY", fit.pixelOffsetY());
                body.put("fit", fitBody);
            }
            panes.add(body);
        }
        return ResponseEntity.ok().body(panes);
    }

    @GetMapping(value = "/canvas", produces = MediaType.IMAGE_JPEG_VALUE)
    public ResponseEntity<byte[]> canvas() {
        return ResponseEntity.ok().contentType(MediaType.IMAGE_JPEG).body(canvasService.renderJpeg());
    }

    private static Map<String, Object> reportBody(TransitionReport report) {
        List<String> updated = new ArrayList<>();
        for (PanePair pair : report.getUpdatedPairs()) {
            updated.add(pair.toString());
        }
        List<Map<String, Object>> failures = new ArrayList<>();
        for (PairFailure failure : report.getFailures()) {
            Map<String, Object> f = new LinkedHashMap<>();
            f.put("pair", failure.getPair().toString());
            f.put("error", failure.getError().getMessage());
            f.put("timeout", failure.getError() instanceof DetectorUnavailableException
                    && ((DetectorUnavailableException) failure.getError()).isTimeout());
            failures.add(f);
        }
        Map<String, Object> response = new HashMap<>();
        response.put("success", !report.hasFailures());
        response.put("pane", report.getPaneId());
        response.put("updatedPairs", updated);
        response.put("failures", failures);
        return response;
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        return ResponseEntity.status(status).body(error);
    }
}
