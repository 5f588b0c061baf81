package quokka.core.model.key;

/**
 * Outcome of one scheduled lifecycle sweep.
 *
 * @param activated pending keys activated
 * @param expired   active keys expired
 * @param generated successor keys generated
 * @param archived  keys archived
 * @param deleted   archived key records deleted
 */
public record KeyRotationSummary(int activated, int expired, int generated, int archived, int deleted) {

    public boolean hasChanges() {
        return activated + expired + generated + archived + deleted > 0;
    }
}
