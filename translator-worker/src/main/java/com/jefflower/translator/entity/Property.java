package com.jefflower.translator.entity;

import com.jefflower.translator.enums.LanguageCode;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.DynamicUpdate;

import java.time.LocalDateTime;

/**
 * 房源表，源内容由抓取服务写入；UPDATE 只包含实际修改的列
 */
@Data
@Entity
@DynamicUpdate
@Table(name = "properties")
public class Property {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "external_id", unique = true, length = 50)
    private String externalId;

    // 源语言（格鲁吉亚语）内容
    @Column(name = "title", length = 500)
    private String title;

    @Column(name = "description", length = 10000)
    private String description;

    @Column(name = "title_en", length = 500)
    private String titleEn;

    @Column(name = "description_en", length = 10000)
    private String descriptionEn;

    @Column(name = "title_ru", length = 500)
    private String titleRu;

    @Column(name = "description_ru", length = 10000)
    private String descriptionRu;

    @Column(name = "translation_attempted_at")
    private LocalDateTime translationAttemptedAt;

    @Column(name = "translated_at")
    private LocalDateTime translatedAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PreUpdate
    public void preUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    public String getLocalizedTitle(LanguageCode language) {
        return switch (language) {
            case EN -> titleEn;
            case RU -> titleRu;
        };
    }

    public String getLocalizedDescription(LanguageCode language) {
        return switch (language) {
            case EN -> descriptionEn;
            case RU -> descriptionRu;
        };
    }

    public void setLocalizedTitle(LanguageCode language, String value) {
        switch (language) {
            case EN -> titleEn = value;
            case RU -> titleRu = value;
        }
    }

    public void setLocalizedDescription(LanguageCode language, String value) {
        switch (language) {
            case EN -> descriptionEn = value;
            case RU -> descriptionRu = value;
        }
    }
}
