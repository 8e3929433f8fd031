package de.kherud.superres.image;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import static java.lang.System.Logger.Level.DEBUG;

/**
 * {@link ImageCodec} backed by {@code javax.imageio}.
 *
 * Reads any format ImageIO understands (PNG, JPEG, BMP, GIF, ...). Output is
 * always PNG whatever the file extension. The file is written next to the target
 * and moved over it, so an existing file is replaced and a failed encode leaves
 * the old file untouched. The parent directory must exist.
 */
public class ImageIoCodec implements ImageCodec {
	private static final System.Logger logger = System.getLogger(ImageIoCodec.class.getName());

	public static final String OUTPUT_FORMAT = "png";

	@Override
	public BufferedImage read(Path path) throws IOException {
		if (!Files.isRegularFile(path)) {
			throw new NoSuchFileException(path.toString(), null, "Input image does not exist");
		}
		BufferedImage image;
		try (InputStream in = Files.newInputStream(path)) {
			image = ImageIO.read(in);
		}
		if (image == null) {
			throw new IOException("Invalid or unsupported image format: " + path);
		}
		logger.log(DEBUG, "Decoded " + path + " (" + image.getWidth() + "x" + image.getHeight() + ")");
		return image;
	}

	@Override
	public void write(BufferedImage image, Path path) throws IOException {
		Path target = path.toAbsolutePath();
		Path parent = target.getParent();
		if (parent == null || !Files.isDirectory(parent)) {
			throw new NoSuchFileException(String.valueOf(parent), null, "Output directory does not exist");
		}

		Path temp = Files.createTempFile(parent, "." + target.getFileName(), ".tmp");
		try {
			try (OutputStream out = Files.newOutputStream(temp)) {
				if (!ImageIO.write(image, OUTPUT_FORMAT, out)) {
					throw new IOException("No " + OUTPUT_FORMAT + " writer available for image type " + image.getType());
				}
			}
			Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
		} finally {
			Files.deleteIfExists(temp);
		}
		logger.log(DEBUG, "Encoded " + image.getWidth() + "x" + image.getHeight() + " image to " + target);
	}
}
