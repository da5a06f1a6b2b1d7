package com.canvaslink.API;

import com.canvaslink.imageOperator.CanvasImage;
import com.canvaslink.imageOperator.MatImage;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import static org.bytedeco.opencv.global.opencv_imgcodecs.*;

@Service
public class ImageCodecService {

	/**
	 * Checks that an uploaded file looks like an image (content type and extension).
	 */
	public boolean isValidImageFile(MultipartFile file) {
		if (file == null || file.isEmpty()) return false;

		String contentType = file.getContentType();
		if (contentType == null || !contentType.startsWith("image/")) {
			return false;
		}

		String originalFilename = file.getOriginalFilename();
		return originalFilename != null &&
				originalFilename.matches("(?i).+\\.(jpg|jpeg|png|bmp|webp|tif|tiff)$");
	}

	/**
	 * Decodes encoded image bytes into a three channel BGR image.
	 *
	 * @throws IllegalArgumentException if the bytes are not a decodable image
	 */
	public CanvasImage decode(byte[] data) {
		if (data == null || data.length == 0) {
			throw new IllegalArgumentException("Image data is empty");
		}
		Mat encoded = new Mat(data);
		Mat decoded = imdecode(encoded, IMREAD_COLOR);
		encoded.release();
		if (decoded == null || decoded.empty()) {
			throw new IllegalArgumentException("Image data could not be decoded");
		}
		return new MatImage(decoded);
	}

	public byte[] encodeJpeg(Mat image) {
		BytePointer buffer = new BytePointer();
		if (!imencode(".jpg", image, buffer)) {
			buffer.close();
			throw new IllegalStateException("JPEG encoding failed");
		}
		byte[] bytes = new byte[(int) buffer.limit()];
		buffer.get(bytes);
		buffer.close();
		return bytes;
	}
}
