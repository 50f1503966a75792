package com.vectororm.orm.query;

import com.vectororm.common.model.ConsistencyLevel;
import com.vectororm.common.model.SortKey;
import com.vectororm.orm.exception.CompileException;
import com.vectororm.orm.exception.QueryConfigException;
import com.vectororm.orm.exception.SchemaException;
import com.vectororm.orm.expression.Condition;
import com.vectororm.orm.expression.ExpressionCompiler;
import com.vectororm.orm.expression.Filters;
import com.vectororm.orm.fixture.Article;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Chain-time behaviour; nothing here reaches a client.
 */
class QuerySetTest {

    private static final List<Float> VECTOR = List.of(0.1f, 0.2f, 0.3f);

    private final ExpressionCompiler compiler = new ExpressionCompiler();

    @Test
    @DisplayName("Chain methods return new querysets and leave the receiver untouched")
    void shouldNotMutateReceiver() {
        QuerySet<Article> base = Article.SCHEMA.objects();

        QuerySet<Article> filtered = base.filter("views__gt", 10).orderBy("-views").limit(5).offset(2);

        assertThat(base.spec()).isEqualTo(QuerySpec.EMPTY);
        assertThat(filtered).isNotSameAs(base);
        assertThat(filtered.spec().orderBy()).isEqualTo(new SortKey("views", true));
        assertThat(filtered.spec().limit()).isEqualTo(5);
        assertThat(filtered.spec().offset()).isEqualTo(2);
    }

    @Test
    @DisplayName("Successive filters AND together regardless of grouping")
    void shouldCombineFiltersAssociatively() {
        Condition a = Filters.gt("views", 1);
        Condition b = Filters.contains("title", "db");
        Condition c = Filters.eq("published", true);

        QuerySet<Article> chained = Article.SCHEMA.objects().filter(a).filter(b).filter(c);
        QuerySet<Article> grouped = Article.SCHEMA.objects().filter(a).filter(b.and(c));

        assertThat(compiler.render(chained.spec().where()))
                .isEqualTo(compiler.render(grouped.spec().where()))
                .isEqualTo("views > 1 and title like \"%db%\" and published == true");
    }

    @Test
    @DisplayName("exclude() negates its predicate")
    void shouldExclude() {
        QuerySet<Article> qs = Article.SCHEMA.objects().filter("views__gt", 1).exclude("title__startswith", "Draft");

        assertThat(compiler.render(qs.spec().where())).isEqualTo("views > 1 and not (title like \"Draft%\")");
    }

    @Test
    @DisplayName("Invalid predicates fail when attached")
    void shouldRejectInvalidPredicates() {
        QuerySet<Article> qs = Article.SCHEMA.objects();

        assertThatThrownBy(() -> qs.filter("missing", 1)).isInstanceOf(CompileException.class);
        assertThatThrownBy(() -> qs.filter("views", "many")).isInstanceOf(CompileException.class);
        assertThatThrownBy(() -> qs.filter("embedding", 1)).isInstanceOf(CompileException.class);
        assertThatThrownBy(() -> qs.exclude("distance__lt", 0.5)).isInstanceOf(CompileException.class);
        assertThatThrownBy(() -> qs.filter((Condition) null)).isInstanceOf(CompileException.class);
    }

    @Test
    @DisplayName("order_by rejects unknown and unorderable fields")
    void shouldValidateOrdering() {
        QuerySet<Article> qs = Article.SCHEMA.objects();

        assertThatThrownBy(() -> qs.orderBy("missing")).isInstanceOf(SchemaException.class);
        assertThatThrownBy(() -> qs.orderBy("embedding")).isInstanceOf(QueryConfigException.class);
        assertThatThrownBy(() -> qs.orderBy("metadata")).isInstanceOf(QueryConfigException.class);
        assertThatThrownBy(() -> qs.orderBy("-distance")).isInstanceOf(QueryConfigException.class);
        assertThatThrownBy(() -> qs.orderBy("")).isInstanceOf(QueryConfigException.class);
    }

    @Test
    @DisplayName("Scalar ordering conflicts with search in either call order")
    void shouldRejectOrderingWithSearch() {
        QuerySet<Article> qs = Article.SCHEMA.objects();

        assertThatThrownBy(() -> qs.orderBy("views").search(VECTOR, "embedding"))
                .isInstanceOf(QueryConfigException.class);
        assertThatThrownBy(() -> qs.search(VECTOR, "embedding").orderBy("-views"))
                .isInstanceOf(QueryConfigException.class);

        QuerySet<Article> ranked = qs.search(VECTOR, "embedding").orderBy("distance");
        assertThat(ranked.spec().orderBy()).isEqualTo(new SortKey("distance", false));
        assertThat(qs.orderBy("distance").search(VECTOR, "embedding").spec().search()).isNotNull();
    }

    @Test
    @DisplayName("limit and offset reject out-of-range values")
    void shouldValidatePagination() {
        QuerySet<Article> qs = Article.SCHEMA.objects();

        assertThatThrownBy(() -> qs.limit(0)).isInstanceOf(QueryConfigException.class);
        assertThatThrownBy(() -> qs.limit(-3)).isInstanceOf(QueryConfigException.class);
        assertThatThrownBy(() -> qs.offset(-1)).isInstanceOf(QueryConfigException.class);
        assertThat(qs.offset(0).spec().offset()).isZero();
    }

    @Test
    @DisplayName("search validates field, dimension, top_k and metric")
    void shouldValidateSearch() {
        QuerySet<Article> qs = Article.SCHEMA.objects();

        assertThatThrownBy(() -> qs.search(VECTOR, "title")).isInstanceOf(SchemaException.class);
        assertThatThrownBy(() -> qs.search(VECTOR, "missing")).isInstanceOf(SchemaException.class);
        assertThatThrownBy(() -> qs.search(List.of(1f, 2f), "embedding"))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("dimension");
        assertThatThrownBy(() -> qs.search(VECTOR, "embedding", "L2", 0)).isInstanceOf(SchemaException.class);
        assertThatThrownBy(() -> qs.search(VECTOR, "embedding", " ", 5)).isInstanceOf(SchemaException.class);
    }

    @Test
    @DisplayName("search(vector, field) uses the field's metric and ten results")
    void shouldApplySearchDefaults() {
        SearchDirective search = Article.SCHEMA.objects().search(new float[]{1f, 2f, 3f}, "embedding").spec().search();

        assertThat(search.field()).isEqualTo("embedding");
        assertThat(search.metric()).isEqualTo("COSINE");
        assertThat(search.topK()).isEqualTo(SearchDirective.DEFAULT_TOP_K);
        assertThat(search.vector()).containsExactly(1f, 2f, 3f);
    }

    @Test
    @DisplayName("annotate_distance attaches a default search")
    void shouldAnnotateDistance() {
        QuerySet<Article> qs = Article.SCHEMA.objects().annotateDistance("embedding", VECTOR).filter("distance__lt", 0.4);

        assertThat(qs.spec().search()).isEqualTo(new SearchDirective("embedding", VECTOR, "COSINE", 10));
    }

    @Test
    @DisplayName("Projections always keep the primary key")
    void shouldProjectWithPrimaryKey() {
        QuerySet<Article> qs = Article.SCHEMA.objects();

        assertThat(qs.only("title").spec().projection()).containsExactly("id", "title");
        assertThat(qs.defer("embedding", "metadata", "id").spec().projection())
                .containsExactly("id", "title", "views", "rating", "published");
        assertThat(qs.only("title", "views").defer("views").spec().projection()).containsExactly("id", "title");
        assertThatThrownBy(() -> qs.only("nope")).isInstanceOf(SchemaException.class);
        assertThatThrownBy(() -> qs.defer("nope")).isInstanceOf(SchemaException.class);
    }

    @Test
    @DisplayName("on() overrides the collection")
    void shouldOverrideCollection() {
        assertThat(Article.SCHEMA.objects().on("articles_archive").spec().collection()).isEqualTo("articles_archive");
        assertThatThrownBy(() -> Article.SCHEMA.objects().on("")).isInstanceOf(QueryConfigException.class);
    }

    @Test
    @DisplayName("consistency() is recorded on the spec and rejects null")
    void shouldRecordConsistency() {
        QuerySet<Article> qs = Article.SCHEMA.objects().consistency(ConsistencyLevel.STRONG);

        assertThat(qs.spec().consistency()).isEqualTo(ConsistencyLevel.STRONG);
        assertThat(qs.filter("views__gt", 1).spec().consistency()).isEqualTo(ConsistencyLevel.STRONG);
        assertThat(Article.SCHEMA.objects().spec().consistency()).isNull();
        assertThatThrownBy(() -> Article.SCHEMA.objects().consistency(null)).isInstanceOf(QueryConfigException.class);
    }
}
