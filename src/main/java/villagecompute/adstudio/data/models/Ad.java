package villagecompute.adstudio.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Scraped advertisement from the ad catalog.
 *
 * <p>
 * Rows are written by the scraper ingestion pipeline; this service only reads them to build the source ad summary on
 * generation job detail. {@code media_urls} holds a JSON array of strings.
 */
@Entity
@Table(
        name = "ads")
public class Ad extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false,
            length = 64)
    public String id;

    @Column(
            length = 32)
    public String platform;

    @Column(
            length = 1000)
    public String headline;

    @Column(
            name = "body_text",
            length = 8000)
    public String bodyText;

    @Column(
            name = "thumbnail_url",
            length = 2048)
    public String thumbnailUrl;

    @Column(
            name = "media_urls",
            length = 8192)
    public String mediaUrls;

    @Column(
            name = "created_at")
    public Instant createdAt;
}
