package com.starsalign.API;

import com.starsalign.imageAlignment.AlignmentStrategy;
import com.starsalign.imageAlignment.exception.DegenerateInputException;
import com.starsalign.imageAlignment.exception.EstimationFailureException;
import com.starsalign.imageAlignment.exception.InsufficientCorrespondencesException;
import com.starsalign.imageAlignment.exception.ScratchResourceException;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class AlignmentController {
    private static final Logger logger = LoggerFactory.getLogger(AlignmentController.class);

    @Autowired
    private AlignmentService alignmentService;

    @Autowired
    private ImageCodecService imageCodecService;

    /**
     * Science image resampled into the reference frame, as 32-bit float TIFF.
     */
    @PostMapping(value = "/align", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> align(
            @RequestParam("reference") MultipartFile reference,
            @RequestParam("science") MultipartFile science,
            @RequestParam(value = "strategy", required = false) String strategy) {
        return process(reference, science, strategy, alignmentService::align);
    }

    /**
     * Reference minus the aligned science image, as 32-bit float TIFF.
     */
    @PostMapping(value = "/diff", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> diff(
            @RequestParam("reference") MultipartFile reference,
            @RequestParam("science") MultipartFile science,
            @RequestParam(value = "strategy", required = false) String strategy) {
        return process(reference, science, strategy, alignmentService::diff);
    }

    private ResponseEntity<?> process(MultipartFile reference, MultipartFile science, String strategy,
                                      ImageOperation operation) {
        Mat ref = null;
        Mat sci = null;
        Mat result = null;
        try {
            AlignmentStrategy resolved = alignmentService.resolveStrategy(strategy);
            ref = imageCodecService.decode(reference);
            sci = imageCodecService.decode(science);
            logger.info("Processing {} against {} with strategy {}",
                    science.getOriginalFilename(), reference.getOriginalFilename(), resolved);

            result = operation.apply(ref, sci, resolved);
            byte[] body = imageCodecService.encodeTiff(result);

            return ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType(ImageCodecService.TIFF_MEDIA_TYPE))
                    .body(body);
        } catch (IllegalArgumentException | ImageDecodingException | DegenerateInputException e) {
            return error(HttpStatus.BAD_REQUEST, e);
        } catch (InsufficientCorrespondencesException | EstimationFailureException e) {
            return error(HttpStatus.UNPROCESSABLE_ENTITY, e);
        } catch (ScratchResourceException e) {
            logger.error("Scratch storage failure", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
        } finally {
            if (ref != null) ref.release();
            if (sci != null) sci.release();
            if (result != null) result.release();
        }
    }

    @FunctionalInterface
    private interface ImageOperation {
        Mat apply(Mat reference, Mat science, AlignmentStrategy strategy);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, Exception e) {
        logger.warn("Request failed with {}: {}", status.value(), e.getMessage());
        Map<String, String> error = new HashMap<>();
        error.put("error", e.getMessage());
        error.put("type", e.getClass().getSimpleName());
        return ResponseEntity.status(status).body(error);
    }
}
