package com.vectororm.orm.fixture;

import com.vectororm.orm.field.Field;
import com.vectororm.orm.model.Model;
import com.vectororm.orm.model.ModelSchema;

import java.util.List;

public class Article extends Model {

    public static final Field<Long> ID = Field.int64("id").primaryKey().build();
    public static final Field<String> TITLE = Field.varchar("title", 200).build();
    public static final Field<Long> VIEWS = Field.int64("views").defaultValue(0L).build();
    public static final Field<Double> RATING = Field.floating("rating").nullable().build();
    public static final Field<Boolean> PUBLISHED = Field.bool("published").defaultValue(false).build();
    public static final Field<Object> METADATA = Field.json("metadata").nullable().build();
    public static final Field<List<Float>> EMBEDDING = Field.floatVector("embedding", 3).metric("COSINE").build();

    public static final ModelSchema<Article> SCHEMA = ModelSchema.builder(Article.class, Article::new)
            .collection("articles")
            .alias(Fixtures.ALIAS)
            .registry(Fixtures.REGISTRY)
            .fields(ID, TITLE, VIEWS, RATING, PUBLISHED, METADATA, EMBEDDING)
            .build();

    public Article() {
        super(SCHEMA);
    }

    public static Article of(long id, String title, float... embedding) {
        Article article = new Article();
        article.set(ID, id);
        article.set(TITLE, title);
        article.set(EMBEDDING.getName(), embedding);
        return article;
    }

    public Long getId() {
        return get(ID);
    }

    public String getTitle() {
        return get(TITLE);
    }

    public Long getViews() {
        return get(VIEWS);
    }
}
