package com.codegraph.core.service.ingest;

import com.codegraph.core.service.config.PipelineConfig;
import com.codegraph.core.service.model.Language;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Walks a repository directory and reads every indexable source file.
 *
 * Skipped: excluded paths, unknown extensions, filtered languages, binary files
 * (NUL byte in the first 1024 bytes), files over the size limit and invalid UTF-8.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemRepositoryIndexer implements RepositoryIndexer {

    private static final int BINARY_SNIFF_BYTES = 1024;

    // .h could be C or C++; C++ is assumed
    private static final Map<String, Language> LANGUAGE_BY_EXTENSION = Map.ofEntries(
            Map.entry(".py", Language.PYTHON),
            Map.entry(".js", Language.JAVASCRIPT),
            Map.entry(".jsx", Language.JAVASCRIPT),
            Map.entry(".ts", Language.TYPESCRIPT),
            Map.entry(".tsx", Language.TYPESCRIPT),
            Map.entry(".java", Language.JAVA),
            Map.entry(".go", Language.GO),
            Map.entry(".rs", Language.RUST),
            Map.entry(".c", Language.C),
            Map.entry(".cpp", Language.CPP),
            Map.entry(".cc", Language.CPP),
            Map.entry(".cxx", Language.CPP),
            Map.entry(".c++", Language.CPP),
            Map.entry(".h", Language.CPP),
            Map.entry(".hpp", Language.CPP),
            Map.entry(".cs", Language.CSHARP)
    );

    private final PipelineConfig pipelineConfig;

    // ==================== RepositoryIndexer Interface ====================

    @Override
    public List<ParseUnit> index(Path root, RepoSpec spec) {
        log.info("Indexing repository at {}", root);

        List<ParseUnit> units = new ArrayList<>();
        for (Path file : listFiles(root)) {
            String relativePath = root.relativize(file).toString().replace('\\', '/');
            toParseUnit(file, relativePath, spec).ifPresent(units::add);
        }

        log.info("Indexed {} files", units.size());
        return units;
    }

    // ==================== Filtering ====================

    private Optional<ParseUnit> toParseUnit(Path file, String relativePath, RepoSpec spec) {
        if (!isUnderPaths(relativePath, spec.paths())) {
            return Optional.empty();
        }
        if (shouldExclude(relativePath, spec.excludePatterns())) {
            log.debug("Skipping excluded file: {}", relativePath);
            return Optional.empty();
        }

        Optional<Language> language = detectLanguage(relativePath);
        if (language.isEmpty()) {
            log.debug("Skipping unsupported file: {}", relativePath);
            return Optional.empty();
        }
        if (!spec.languages().isEmpty() && !spec.languages().contains(language.get())) {
            log.debug("Skipping file with filtered language: {}", relativePath);
            return Optional.empty();
        }

        try {
            long size = Files.size(file);
            if (size > pipelineConfig.getMaxFileSizeBytes()) {
                log.warn("Skipping large file: {} ({} bytes)", relativePath, size);
                return Optional.empty();
            }
            if (isBinary(file)) {
                log.debug("Skipping binary file: {}", relativePath);
                return Optional.empty();
            }
            return decodeUtf8(Files.readAllBytes(file))
                    .map(content -> new ParseUnit(spec.repoId(), relativePath, language.get(), content, size))
                    .or(() -> {
                        log.warn("Skipping file with encoding issues: {}", relativePath);
                        return Optional.empty();
                    });
        } catch (IOException e) {
            log.warn("Skipping unreadable file {}: {}", relativePath, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean isUnderPaths(String relativePath, List<String> paths) {
        if (paths.isEmpty()) {
            return true;
        }
        return paths.stream()
                .map(path -> path.replace('\\', '/').replaceAll("^\\./", "").replaceAll("/+$", ""))
                .anyMatch(path -> path.isEmpty() || relativePath.equals(path) || relativePath.startsWith(path + "/"));
    }

    /**
     * Pattern forms: {@code *suffix}, {@code prefix*}, a glob where {@code *} also matches
     * {@code /}, or an exact path.
     */
    static boolean shouldExclude(String relativePath, List<String> patterns) {
        for (String pattern : patterns) {
            if (pattern.startsWith("*") && pattern.indexOf('*', 1) < 0) {
                if (relativePath.endsWith(pattern.substring(1))) {
                    return true;
                }
            } else if (pattern.endsWith("*") && pattern.indexOf('*') == pattern.length() - 1) {
                if (relativePath.startsWith(pattern.substring(0, pattern.length() - 1))) {
                    return true;
                }
            } else if (pattern.contains("*") || pattern.contains("?")) {
                if (globToRegex(pattern).matcher(relativePath).matches()) {
                    return true;
                }
            } else if (relativePath.equals(pattern)) {
                return true;
            }
        }
        return false;
    }

    private static Pattern globToRegex(String glob) {
        var regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }

    static Optional<Language> detectLanguage(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        return Optional.ofNullable(LANGUAGE_BY_EXTENSION.get(name.substring(dot)));
    }

    // ==================== File Access ====================

    private List<Path> listFiles(Path root) {
        try (Stream<Path> files = Files.walk(root)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(file -> !isInsideGitDirectory(root, file))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot walk repository " + root, e);
        }
    }

    private boolean isInsideGitDirectory(Path root, Path file) {
        for (Path part : root.relativize(file)) {
            if (".git".equals(part.toString())) {
                return true;
            }
        }
        return false;
    }

    private boolean isBinary(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            byte[] head = in.readNBytes(BINARY_SNIFF_BYTES);
            for (byte b : head) {
                if (b == 0) {
                    return true;
                }
            }
            return false;
        }
    }

    private Optional<String> decodeUtf8(byte[] bytes) {
        try {
            return Optional.of(StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }
}
