package airbrake;

/**
 * Accepted response from the collector.
 *
 * @param id  remote identifier of the stored notice or deploy
 * @param url dashboard link, may be {@code null} (deploy responses carry none)
 */
public record NoticeResponse(String id, String url) {
}
