package com.fatec.rag_compliance.service.retrieval;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.WhitespaceTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * BM25 keyword index over the corpus texts, held in an in-memory Lucene index.
 * Documents are tokenized by whitespace and lowercased; no stemming.
 */
public class LexicalIndex implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(LexicalIndex.class);

    private static final String CONTENT_FIELD = "content";
    private static final String POSITION_FIELD = "position";

    // Whole whitespace-separated tokens, up to what a Lucene term can hold in UTF-8.
    static final int MAX_TOKEN_LENGTH = IndexWriter.MAX_TERM_LENGTH / 3;

    private static final Analyzer ANALYZER = new WhitespaceLowercaseAnalyzer();

    private final List<String> texts;
    private final float k1;
    private final float b;
    private final Directory directory;
    private final DirectoryReader reader;
    private final IndexSearcher searcher;

    private LexicalIndex(List<String> texts, float k1, float b) throws IOException {
        this.texts = List.copyOf(texts);
        this.k1 = k1;
        this.b = b;
        BM25Similarity similarity = new BM25Similarity(k1, b);

        this.directory = new ByteBuffersDirectory();
        IndexWriterConfig config = new IndexWriterConfig(ANALYZER);
        config.setSimilarity(similarity);
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE);
        try (IndexWriter writer = new IndexWriter(directory, config)) {
            for (int i = 0; i < this.texts.size(); i++) {
                Document doc = new Document();
                doc.add(new StoredField(POSITION_FIELD, i));
                doc.add(new TextField(CONTENT_FIELD, this.texts.get(i), Field.Store.NO));
                writer.addDocument(doc);
            }
            writer.commit();
        }
        this.reader = DirectoryReader.open(directory);
        this.searcher = new IndexSearcher(reader);
        this.searcher.setSimilarity(similarity);
    }

    public static LexicalIndex build(List<String> texts, float k1, float b) {
        try {
            return new LexicalIndex(texts, k1, b);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to build BM25 index", e);
        }
    }

    /**
     * Splits on whitespace and lowercases, exactly as documents are indexed.
     */
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        try (TokenStream stream = ANALYZER.tokenStream(CONTENT_FIELD, text)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(term.toString());
            }
            stream.end();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to tokenize query", e);
        }
        return tokens;
    }

    public int size() {
        return texts.size();
    }

    /**
     * Scores each candidate against the query tokens. The result is aligned with
     * {@code candidates}; documents matching no token score 0.0.
     * <p>
     * When the candidates are a strict subset of the corpus, a transient index is
     * built over that subset so term statistics reflect only the candidates.
     *
     * @param candidates distinct source indexes
     */
    public double[] score(List<String> queryTokens, int[] candidates) {
        double[] scores = new double[candidates.length];
        if (queryTokens.isEmpty() || candidates.length == 0) {
            return scores;
        }
        if (candidates.length == texts.size()) {
            double[] all = scoreAll(queryTokens);
            for (int i = 0; i < candidates.length; i++) {
                scores[i] = all[candidates[i]];
            }
            return scores;
        }

        List<String> subset = new ArrayList<>(candidates.length);
        for (int candidate : candidates) {
            subset.add(texts.get(candidate));
        }
        try (LexicalIndex scoped = build(subset, k1, b)) {
            return scoped.scoreAll(queryTokens);
        }
    }

    private double[] scoreAll(List<String> queryTokens) {
        double[] scores = new double[texts.size()];
        if (texts.isEmpty()) {
            return scores;
        }
        try {
            TopDocs topDocs = searcher.search(toQuery(queryTokens), texts.size());
            StoredFields storedFields = searcher.storedFields();
            for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
                int position = storedFields.document(scoreDoc.doc)
                        .getField(POSITION_FIELD).numericValue().intValue();
                scores[position] = scoreDoc.score;
            }
            return scores;
        } catch (IOException e) {
            throw new UncheckedIOException("BM25 search failed", e);
        }
    }

    // Repeated query tokens count once per occurrence, as a boost on a single clause.
    private BooleanQuery toQuery(List<String> queryTokens) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String token : queryTokens) {
            counts.merge(token, 1, Integer::sum);
        }
        int maxClauses = IndexSearcher.getMaxClauseCount();
        if (counts.size() > maxClauses) {
            log.debug("Query has {} distinct terms, keeping the first {}", counts.size(), maxClauses);
        }

        BooleanQuery.Builder builder = new BooleanQuery.Builder();
        int added = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (added++ == maxClauses) {
                break;
            }
            TermQuery termQuery = new TermQuery(new Term(CONTENT_FIELD, entry.getKey()));
            if (entry.getValue() == 1) {
                builder.add(termQuery, BooleanClause.Occur.SHOULD);
            } else {
                builder.add(new BoostQuery(termQuery, entry.getValue()), BooleanClause.Occur.SHOULD);
            }
        }
        return builder.build();
    }

    @Override
    public void close() {
        try {
            reader.close();
            directory.close();
        } catch (IOException e) {
            log.warn("Failed to release BM25 index: {}", e.getMessage());
        }
    }

    private static final class WhitespaceLowercaseAnalyzer extends Analyzer {
        @Override
        protected TokenStreamComponents createComponents(String fieldName) {
            Tokenizer source = new WhitespaceTokenizer(TokenStream.DEFAULT_TOKEN_ATTRIBUTE_FACTORY, MAX_TOKEN_LENGTH);
            return new TokenStreamComponents(source, new LowerCaseFilter(source));
        }
    }
}
