package ai.romantext.harmony.score;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads scores from the JSON extract format produced by the notation front end.
 */
public class JsonScoreSource implements ScoreSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonScoreSource.class);

    private static final Gson GSON = new GsonBuilder().create();

    record ScorePayload(MetadataDto metadata, List<TimeSignatureDto> timeSignatures, List<PartDto> parts) {
    }

    record MetadataDto(String composer, String title, String movementNumber, String movementName) {
    }

    record TimeSignatureDto(int measure, String ratio) {
    }

    record PartDto(String name, List<MeasureDto> measures) {
    }

    record MeasureDto(int number, List<NoteDto> notes, List<ExpressionDto> expressions) {
    }

    record NoteDto(String beat, String duration, List<String> pitches, String lyric) {
    }

    record ExpressionDto(String beat, String text) {
    }

    @Override
    public Score load(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("score path must be provided");
        }
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read score extract: " + path, ex);
        }
        Score score = parse(json);
        LOGGER.info("Loaded {} with {} parts, measures {}-{}", path.getFileName(), score.partCount(),
                score.firstMeasureNumber(), score.lastMeasureNumber());
        return score;
    }

    public Score parse(String json) {
        ScorePayload payload;
        try {
            payload = GSON.fromJson(json, ScorePayload.class);
        } catch (JsonParseException ex) {
            throw new ScoreFormatException("Malformed score extract: " + ex.getMessage(), ex);
        }
        if (payload == null || payload.parts() == null || payload.parts().isEmpty()) {
            throw new ScoreFormatException("Score extract contains no parts");
        }
        try {
            return new Score(toMetadata(payload.metadata()), toTimeSignatures(payload.timeSignatures()),
                    payload.parts().stream().map(JsonScoreSource::toPart).toList());
        } catch (IllegalArgumentException | NullPointerException ex) {
            throw new ScoreFormatException("Invalid score extract: " + ex.getMessage(), ex);
        }
    }

    private static ScoreMetadata toMetadata(MetadataDto dto) {
        if (dto == null) {
            return ScoreMetadata.empty();
        }
        return new ScoreMetadata(Optional.ofNullable(dto.composer()), Optional.ofNullable(dto.title()),
                Optional.ofNullable(dto.movementNumber()), Optional.ofNullable(dto.movementName()));
    }

    private static List<TimeSignature> toTimeSignatures(List<TimeSignatureDto> dtos) {
        if (dtos == null) {
            return List.of();
        }
        return dtos.stream().map(dto -> new TimeSignature(dto.measure(), dto.ratio())).toList();
    }

    private static Part toPart(PartDto dto) {
        List<MeasureDto> measureDtos = dto.measures() == null ? List.of() : dto.measures();
        List<Measure> measures = new ArrayList<>(measureDtos.size());
        for (MeasureDto measureDto : measureDtos) {
            measures.add(toMeasure(measureDto));
        }
        return new Part(dto.name(), measures);
    }

    private static Measure toMeasure(MeasureDto dto) {
        List<Note> notes = dto.notes() == null ? List.of() : dto.notes().stream()
                .map(JsonScoreSource::toNote)
                .toList();
        List<TextExpression> expressions = dto.expressions() == null ? List.of() : dto.expressions().stream()
                .map(expression -> new TextExpression(Rational.parse(expression.beat()), expression.text()))
                .toList();
        return new Measure(dto.number(), notes, expressions);
    }

    private static Note toNote(NoteDto dto) {
        List<Pitch> pitches = dto.pitches() == null ? List.of() : dto.pitches().stream()
                .map(Pitch::parse)
                .toList();
        return new Note(Rational.parse(dto.beat()), Rational.parse(dto.duration()), pitches,
                Optional.ofNullable(dto.lyric()));
    }
}
