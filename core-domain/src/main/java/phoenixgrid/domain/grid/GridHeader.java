package phoenixgrid.domain.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Cabecera descriptiva de una tabla de salida: tarjetas ordenadas más líneas COMMENT e HISTORY.
 * Inmutable; se construye con {@link #builder()}.
 */
public final class GridHeader {

    private final List<HeaderCard> cards;
    private final List<String> comments;
    private final List<String> history;

    private GridHeader(List<HeaderCard> cards, List<String> comments, List<String> history) {
        this.cards = Collections.unmodifiableList(new ArrayList<>(cards));
        this.comments = Collections.unmodifiableList(new ArrayList<>(comments));
        this.history = Collections.unmodifiableList(new ArrayList<>(history));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<HeaderCard> getCards() {
        return cards;
    }

    public List<String> getComments() {
        return comments;
    }

    public List<String> getHistory() {
        return history;
    }

    public Optional<HeaderCard> find(String keyword) {
        return cards.stream().filter(card -> card.keyword().equals(keyword)).findFirst();
    }

    public Optional<Object> valueOf(String keyword) {
        return find(keyword).map(HeaderCard::value);
    }

    public static final class Builder {
        private final List<HeaderCard> cards = new ArrayList<>();
        private final List<String> comments = new ArrayList<>();
        private final List<String> history = new ArrayList<>();

        private Builder() {
        }

        public Builder card(String keyword, Object value, String comment) {
            boolean duplicated = cards.stream().anyMatch(card -> card.keyword().equals(keyword));
            if (duplicated) {
                throw new IllegalArgumentException("Palabra clave repetida en la cabecera: " + keyword);
            }
            cards.add(new HeaderCard(keyword, value, comment));
            return this;
        }

        public Builder card(String keyword, Object value) {
            return card(keyword, value, null);
        }

        public Builder comment(String line) {
            comments.add(line);
            return this;
        }

        public Builder history(List<String> lines) {
            history.addAll(lines);
            return this;
        }

        public GridHeader build() {
            return new GridHeader(cards, comments, history);
        }
    }
}
