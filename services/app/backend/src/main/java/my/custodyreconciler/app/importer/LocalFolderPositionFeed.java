package my.custodyreconciler.app.importer;

import my.custodyreconciler.app.config.AppProperties;
import my.custodyreconciler.app.util.CsvParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads the newest {@code *.csv} below {@code <feed root>/<bankId>}. Files are ordered by the
 * {@code yyyyMMdd} date in their name; files without one are ignored.
 */
@Component
public class LocalFolderPositionFeed implements PositionFeed {
	private static final Logger logger = LoggerFactory.getLogger(LocalFolderPositionFeed.class);
	private final Path root;
	private final PositionFileParser parser;

	public LocalFolderPositionFeed(AppProperties properties, PositionFileParser parser) {
		this(Path.of(properties.feed().root()), parser);
	}

	LocalFolderPositionFeed(Path root, PositionFileParser parser) {
		this.root = root;
		this.parser = parser;
	}

	@Override
	public PositionBatch readLatest(String bankId) {
		Path directory = root.resolve(bankId);
		if (!Files.isDirectory(directory)) {
			throw new FeedUnavailableException("No feed directory for bank " + bankId + ": " + directory);
		}
		DatedFile latest = findLatest(directory)
				.orElseThrow(() -> new FeedUnavailableException("No position file for bank " + bankId + " in " + directory));
		logger.info("Reading {} for bank {} (file date {})", latest.path().getFileName(), bankId, latest.fileDate());
		byte[] payload;
		try {
			payload = Files.readAllBytes(latest.path());
		} catch (IOException exc) {
			throw new FeedUnavailableException("Failed to read " + latest.path(), exc);
		}
		return parser.parse(payload, latest.path().getFileName().toString(), bankId, latest.fileDate());
	}

	private Optional<DatedFile> findLatest(Path directory) {
		try (Stream<Path> files = Files.list(directory)) {
			List<DatedFile> candidates = files
					.filter(Files::isRegularFile)
					.filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"))
					.map(path -> new DatedFile(path, CsvParsing.dateFromFilename(path.getFileName().toString())))
					.filter(file -> file.fileDate() != null)
					.toList();
			return candidates.stream()
					.max(Comparator.comparing(DatedFile::fileDate)
							.thenComparing(file -> file.path().getFileName().toString()));
		} catch (IOException exc) {
			throw new FeedUnavailableException("Failed to list " + directory, exc);
		}
	}

	private record DatedFile(Path path, LocalDate fileDate) {
	}
}
