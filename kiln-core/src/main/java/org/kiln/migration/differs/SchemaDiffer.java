package org.kiln.migration.differs;

import lombok.extern.slf4j.Slf4j;
import org.kiln.error.KilnException;
import org.kiln.model.SchemaSnapshot;

import java.util.List;
import java.util.Objects;

@Slf4j
public class SchemaDiffer {
    private final List<Differ> differs;

    public SchemaDiffer() {
        this(createDefaultDiffers());
    }

    public SchemaDiffer(List<Differ> differs) {
        this.differs = List.copyOf(Objects.requireNonNull(differs, "differs must not be null"));
    }

    /**
     * 기본 differs 생성 - 파이프라인 순서 고정
     * 1. EntityDiffer (엔티티 추가/삭제)
     * 2. EntityModificationDiffer (필드, unique 제약, 관계 제약)
     */
    private static List<Differ> createDefaultDiffers() {
        return List.of(
                new EntityDiffer(),
                new EntityModificationDiffer()
        );
    }

    /**
     * Compares two snapshots. A failing differ aborts the whole diff; no partial result is
     * ever returned.
     *
     * @param oldSchema previous snapshot, {@link SchemaSnapshot#empty()} when there is none
     */
    public DiffResult diff(SchemaSnapshot oldSchema, SchemaSnapshot newSchema) {
        Objects.requireNonNull(oldSchema, "oldSchema must not be null");
        Objects.requireNonNull(newSchema, "newSchema must not be null");

        DiffResult result = DiffResult.builder().build();

        for (Differ differ : differs) {
            executeDiffer(differ, oldSchema, newSchema, result);
        }

        result.getWarnings().forEach(w -> log.warn("{}", w));
        return result;
    }

    private void executeDiffer(Differ differ, SchemaSnapshot oldSchema, SchemaSnapshot newSchema, DiffResult result) {
        try {
            differ.diff(oldSchema, newSchema, result);
        } catch (KilnException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new KilnException(String.format(
                    "Differ failed: %s (%s: %s)",
                    differ.getClass().getSimpleName(),
                    e.getClass().getSimpleName(),
                    e.getMessage()), e);
        }
    }
}
