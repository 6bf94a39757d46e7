package com.fatec.rag_compliance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * RAG de Conformidade - Arquitetura: Bi-encoder (embeddings) + Inverted Index
 * (BM25 - Best Match 25), combinados por Reciprocal Rank Fusion.
 * Uso: recuperar as regras de conformidade clínica (PT, OT, SLP) mais
 * relevantes para uma nota de evolução antes de enviá-la ao modelo de
 * linguagem. O BM25 garante precisão em termos exatos (códigos, siglas),
 * os embeddings cobrem a similaridade semântica.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RagComplianceApplication {

	public static void main(String[] args) {
		SpringApplication.run(RagComplianceApplication.class, args);
	}

}
