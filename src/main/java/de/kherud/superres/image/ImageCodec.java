package de.kherud.superres.image;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads and writes raster images on behalf of the scaling service.
 */
public interface ImageCodec {

	/**
	 * Decode an image fully into memory.
	 *
	 * @throws IOException if the file is missing, unreadable or not a supported raster format
	 */
	BufferedImage read(Path path) throws IOException;

	/**
	 * Encode {@code image} to {@code path}, replacing any existing file.
	 *
	 * @throws IOException if the image cannot be encoded or written
	 */
	void write(BufferedImage image, Path path) throws IOException;
}
