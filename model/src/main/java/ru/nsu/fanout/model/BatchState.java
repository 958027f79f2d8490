package ru.nsu.fanout.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Состояние пакета у координатора.
 */
public enum BatchState {
    RECEIVED,     // Пакет принят и провалидирован
    REJECTED,     // Нет живых worker-ов, терминальное
    PROBED,       // Реестр очищен от недоступных worker-ов
    PARTITIONED,  // Файлы разбиты по worker-ам
    DISPATCHING,  // Части отправлены
    AGGREGATED;   // Результаты собраны, терминальное

    public Set<BatchState> successors() {
        switch (this) {
            case RECEIVED:
                return EnumSet.of(REJECTED, PROBED);
            case PROBED:
                return EnumSet.of(PARTITIONED);
            case PARTITIONED:
                return EnumSet.of(DISPATCHING);
            case DISPATCHING:
                return EnumSet.of(AGGREGATED);
            default:
                return EnumSet.noneOf(BatchState.class);
        }
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }
}
